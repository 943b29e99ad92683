package dev.ppee.pipeline;

import dev.ppee.task.TaskCancelledException;
import dev.ppee.task.TaskRegistry;
import dev.ppee.task.TaskStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Publishes stage transitions of one task to the {@link TaskRegistry}. */
final class TaskStageReporter implements StageReporter {

  private static final Logger log = LoggerFactory.getLogger(TaskStageReporter.class);

  private final TaskRegistry registry;
  private final String taskId;

  TaskStageReporter(TaskRegistry registry, String taskId) {
    this.registry = registry;
    this.taskId = taskId;
  }

  @Override
  public void enter(TaskStage stage, int progress, String message) {
    throwIfCancelled();
    registry.advance(taskId, stage, progress, message);
    log.info("Task {} -> {} ({}%): {}", taskId, stage.value(), progress, message);
  }

  @Override
  public void throwIfCancelled() {
    if (registry.isCancelRequested(taskId)) {
      throw new TaskCancelledException(taskId);
    }
  }
}
