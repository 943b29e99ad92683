package dev.ppee.pipeline;

import dev.ppee.task.CancellationCheck;
import dev.ppee.task.TaskStage;

/**
 * Receives stage transitions from a running pipeline.
 *
 * <p>Every {@code enter} call first runs the cancellation guard, so a cancelled task stops before
 * the stage starts.
 */
public interface StageReporter extends CancellationCheck {

  /** Enters a stage at its default progress checkpoint. */
  default void enter(TaskStage stage, String message) {
    enter(stage, stage.checkpoint(), message);
  }

  /** Enters (or re-enters) a stage with an explicit progress value. */
  void enter(TaskStage stage, int progress, String message);
}
