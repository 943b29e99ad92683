package dev.ppee.pipeline;

import dev.ppee.task.PipelineException;
import dev.ppee.task.TaskCancelledException;
import dev.ppee.task.TaskRegistry;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drives one task body on a worker thread and records how it ended.
 *
 * <p>The body receives a {@link StageReporter} bound to the task. A {@link TaskCancelledException}
 * ends the task as cancelled, a {@link PipelineException} as error with its user-safe message, and
 * anything else as error with a generic message; details go to the log only. Whatever happens, the
 * task is terminal when {@link #run} returns.
 */
@Component
public class TaskRunner {

  private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

  static final String GENERIC_ERROR = "An internal error occurred while processing the task";
  static final String CANCELLED_MESSAGE = "Task was cancelled";

  private final TaskRegistry registry;

  public TaskRunner(TaskRegistry registry) {
    this.registry = registry;
  }

  /**
   * Runs {@code work} for task {@code taskId}.
   *
   * @param taskId a task already registered in the {@link TaskRegistry}
   * @param work the task body; its return value becomes the task result
   */
  public void run(String taskId, Function<StageReporter, Object> work) {
    StageReporter reporter = new TaskStageReporter(registry, taskId);
    try {
      Object result = work.apply(reporter);
      // a cancel that arrives during the last stage still wins
      reporter.throwIfCancelled();
      registry.complete(taskId, result, "Completed");
      log.info("Task {} completed", taskId);
    } catch (TaskCancelledException e) {
      registry.markCancelled(taskId, CANCELLED_MESSAGE);
      log.info("Task {} cancelled", taskId);
    } catch (PipelineException e) {
      log.error("Task {} failed: {}", taskId, e.getMessage(), e);
      registry.fail(taskId, e.userMessage());
    } catch (RuntimeException e) {
      log.error("Task {} failed with an unexpected error", taskId, e);
      registry.fail(taskId, GENERIC_ERROR);
    } finally {
      registry
          .get(taskId)
          .filter(snapshot -> !snapshot.status().isTerminal())
          .ifPresent(
              snapshot -> {
                log.error("Task {} ended without a terminal state, marking it failed", taskId);
                registry.fail(taskId, GENERIC_ERROR);
              });
    }
  }
}
