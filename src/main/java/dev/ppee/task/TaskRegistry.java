package dev.ppee.task;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Thread-safe in-memory registry of background tasks.
 *
 * <p>Maintains a {@link ConcurrentHashMap} of {@link TaskSnapshot} records keyed by task id. Each
 * update atomically reads the current snapshot, derives a new immutable record and writes it back
 * using {@code computeIfPresent()}, so the worker and the polling/cancelling threads never race on
 * a partially written state.
 *
 * <p>Rules enforced here:
 *
 * <ul>
 *   <li>progress never decreases while a task is running; lower values are raised to the current
 *       one
 *   <li>stages only move forward ({@link TaskStage#canAdvanceTo})
 *   <li>terminal states are sticky; writes after success, error or cancelled are ignored
 * </ul>
 *
 * <p>Entries are transient and lost on restart. A finished task is evicted once it has been
 * neither updated nor polled for {@code ppee.tasks.retention}. Running tasks are never evicted.
 */
@Component
public class TaskRegistry {

  private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);

  private final ConcurrentHashMap<String, TaskSnapshot> tasks = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Instant> lastPolledAt = new ConcurrentHashMap<>();
  private final Clock clock;
  private final TaskProperties properties;

  public TaskRegistry(Clock clock, TaskProperties properties) {
    this.clock = clock;
    this.properties = properties;
  }

  /**
   * Registers a new pending task.
   *
   * @param kind search or analysis
   * @param plannedStages the stages this task is expected to go through
   * @return the initial snapshot, carrying the generated id
   */
  public TaskSnapshot create(TaskKind kind, List<TaskStage> plannedStages) {
    String id = UUID.randomUUID().toString();
    TaskSnapshot snapshot =
        TaskSnapshot.pending(id, kind, plannedStages, "Task queued", clock.instant());
    tasks.put(id, snapshot);
    log.debug("Registered {} task {}", kind.value(), id);
    return snapshot;
  }

  /**
   * Moves a running task to {@code stage}. A progress value lower than the current one is raised.
   *
   * @throws IllegalStateException if {@code stage} comes before the task's current stage
   */
  public void advance(String taskId, TaskStage stage, int progress, String message) {
    tasks.computeIfPresent(
        taskId,
        (id, current) -> {
          if (current.status().isTerminal()) {
            log.debug("Ignoring stage {} for finished task {}", stage.value(), id);
            return current;
          }
          if (!current.stage().canAdvanceTo(stage)) {
            throw new IllegalStateException(
                "Task %s cannot move back from %s to %s"
                    .formatted(id, current.stage().value(), stage.value()));
          }
          return current.advance(stage, progress, message, clock.instant());
        });
  }

  /** Marks a task successful and stores its result. Ignored if the task already finished. */
  public void complete(String taskId, Object result, String message) {
    terminate(taskId, TaskStatus.SUCCESS, TaskStage.COMPLETE, message, result);
  }

  /** Marks a task failed with a user-safe message. Ignored if the task already finished. */
  public void fail(String taskId, String message) {
    terminate(taskId, TaskStatus.ERROR, TaskStage.FAILED, message, null);
  }

  /** Marks a task cancelled. Ignored if the task already finished. */
  public void markCancelled(String taskId, String message) {
    terminate(taskId, TaskStatus.CANCELLED, TaskStage.CANCELLED, message, null);
  }

  private void terminate(
      String taskId,
      TaskStatus status,
      TaskStage stage,
      String message,
      @Nullable Object result) {
    tasks.computeIfPresent(
        taskId,
        (id, current) -> {
          if (current.status().isTerminal()) {
            log.debug(
                "Task {} already {}, ignoring {}",
                id,
                current.status().value(),
                status.value());
            return current;
          }
          return current.terminate(status, stage, message, result, clock.instant());
        });
  }

  /**
   * Sets the cancellation flag. Idempotent: repeated requests return the same acknowledgement and
   * requests against finished tasks leave them untouched.
   *
   * @return the acknowledgement, or empty if the task is unknown
   */
  public Optional<CancelAcknowledgement> requestCancel(String taskId) {
    TaskSnapshot updated =
        tasks.computeIfPresent(
            taskId,
            (id, current) ->
                current.status().isTerminal() || current.cancelRequested()
                    ? current
                    : current.withCancelRequested(clock.instant()));
    if (updated == null) {
      return Optional.empty();
    }
    if (updated.status().isTerminal()) {
      return Optional.of(
          new CancelAcknowledgement(
              taskId,
              updated.status(),
              updated.cancelRequested(),
              "Task already finished with status " + updated.status().value()));
    }
    log.info("Cancellation requested for task {}", taskId);
    return Optional.of(
        new CancelAcknowledgement(
            taskId,
            updated.status(),
            true,
            "Cancellation requested; the task stops at the next stage boundary"));
  }

  public boolean isCancelRequested(String taskId) {
    TaskSnapshot snapshot = tasks.get(taskId);
    return snapshot != null && snapshot.cancelRequested();
  }

  /**
   * Get the current snapshot for a task. Each lookup of a known task restarts its retention window.
   *
   * @param taskId the task to look up
   * @return snapshot, or empty if unknown or evicted
   */
  public Optional<TaskSnapshot> get(String taskId) {
    TaskSnapshot snapshot = tasks.get(taskId);
    if (snapshot != null) {
      lastPolledAt.put(taskId, clock.instant());
    }
    return Optional.ofNullable(snapshot);
  }

  /** Removes a task outright, used when its submission was rejected. */
  public void remove(String taskId) {
    tasks.remove(taskId);
    lastPolledAt.remove(taskId);
  }

  public int size() {
    return tasks.size();
  }

  /**
   * Drops every finished task whose last update and last poll are both older than the retention
   * window. Pending and running tasks stay until they reach a terminal state.
   *
   * @return number of evicted entries
   */
  @Scheduled(
      fixedDelayString = "${ppee.tasks.eviction-interval-ms:60000}",
      initialDelayString = "${ppee.tasks.eviction-interval-ms:60000}")
  public int evictExpired() {
    Instant cutoff = clock.instant().minus(properties.getRetention());
    int evicted = 0;
    for (Map.Entry<String, TaskSnapshot> entry : tasks.entrySet()) {
      TaskSnapshot snapshot = entry.getValue();
      if (!snapshot.status().isTerminal() || !lastSeen(snapshot).isBefore(cutoff)) {
        continue;
      }
      // remove(key, value) skips entries refreshed since they were read
      if (tasks.remove(entry.getKey(), snapshot)) {
        lastPolledAt.remove(entry.getKey());
        evicted++;
      }
    }
    if (evicted > 0) {
      log.info("Evicted {} expired task(s), {} remaining", evicted, tasks.size());
    }
    return evicted;
  }

  private Instant lastSeen(TaskSnapshot snapshot) {
    Instant polled = lastPolledAt.get(snapshot.id());
    return polled != null && polled.isAfter(snapshot.updatedAt()) ? polled : snapshot.updatedAt();
  }
}
