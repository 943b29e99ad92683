package dev.ppee.task;

/**
 * Cooperative cancellation hook handed to long-running steps.
 *
 * <p>Implementations throw {@link TaskCancelledException} when the owning task should stop.
 */
@FunctionalInterface
public interface CancellationCheck {

  CancellationCheck NONE = () -> {};

  void throwIfCancelled();
}
