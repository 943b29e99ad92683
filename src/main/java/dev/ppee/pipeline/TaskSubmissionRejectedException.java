package dev.ppee.pipeline;

/** The worker pool and its queue are full; the submission left no task behind. */
public class TaskSubmissionRejectedException extends RuntimeException {

  public TaskSubmissionRejectedException(String message, Throwable cause) {
    super(message, cause);
  }
}
