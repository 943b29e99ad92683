package dev.ppee.task;

import java.time.Instant;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Immutable snapshot of a task's state.
 *
 * <p>Created and replaced by {@link TaskRegistry}. Every mutation produces a new record so that
 * readers never observe a half-applied update.
 *
 * @param id the task identifier handed to the submitter
 * @param kind search or analysis
 * @param status lifecycle status
 * @param stage the stage most recently entered
 * @param progress completion percentage in [0, 100]
 * @param message human-readable description of the current step
 * @param stages stages planned for this task, computed once at submission
 * @param result the task's result payload, present only on success
 * @param cancelRequested whether a client asked for cancellation
 * @param createdAt when the task was submitted
 * @param updatedAt when the snapshot was last replaced
 */
public record TaskSnapshot(
    String id,
    TaskKind kind,
    TaskStatus status,
    TaskStage stage,
    int progress,
    String message,
    List<TaskStage> stages,
    @Nullable Object result,
    boolean cancelRequested,
    Instant createdAt,
    Instant updatedAt) {

  public TaskSnapshot {
    stages = stages == null ? List.of() : List.copyOf(stages);
  }

  static TaskSnapshot pending(
      String id, TaskKind kind, List<TaskStage> stages, String message, Instant now) {
    return new TaskSnapshot(
        id, kind, TaskStatus.PENDING, TaskStage.STARTING, 0, message, stages, null, false, now,
        now);
  }

  TaskSnapshot advance(TaskStage nextStage, int nextProgress, String nextMessage, Instant now) {
    return new TaskSnapshot(
        id,
        kind,
        TaskStatus.PROGRESS,
        nextStage,
        Math.max(progress, clamp(nextProgress)),
        nextMessage,
        stages,
        null,
        cancelRequested,
        createdAt,
        now);
  }

  TaskSnapshot terminate(
      TaskStatus terminalStatus,
      TaskStage terminalStage,
      String nextMessage,
      @Nullable Object nextResult,
      Instant now) {
    int finalProgress = terminalStatus == TaskStatus.SUCCESS ? 100 : progress;
    return new TaskSnapshot(
        id,
        kind,
        terminalStatus,
        terminalStage,
        finalProgress,
        nextMessage,
        stages,
        nextResult,
        cancelRequested,
        createdAt,
        now);
  }

  TaskSnapshot withCancelRequested(Instant now) {
    return new TaskSnapshot(
        id, kind, status, stage, progress, message, stages, result, true, createdAt, now);
  }

  private static int clamp(int value) {
    return Math.max(0, Math.min(100, value));
  }
}
