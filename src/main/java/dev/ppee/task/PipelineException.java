package dev.ppee.task;

/**
 * Base class for failures raised while a task is running.
 *
 * <p>The exception message is for logs. {@link #userMessage()} is what polling clients see, so it
 * must never contain stack traces, SQL or internal host names.
 */
public abstract class PipelineException extends RuntimeException {

  private final String userMessage;

  protected PipelineException(String userMessage, String message, Throwable cause) {
    super(message, cause);
    this.userMessage = userMessage;
  }

  protected PipelineException(String userMessage, String message) {
    super(message);
    this.userMessage = userMessage;
  }

  public String userMessage() {
    return userMessage;
  }
}
