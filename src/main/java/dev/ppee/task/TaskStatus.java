package dev.ppee.task;

import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle status of a background task as reported to polling clients. */
public enum TaskStatus {

  /** Created and queued, no worker has picked it up yet. */
  PENDING("pending"),

  /** A worker is executing the task's stages. */
  PROGRESS("progress"),

  /** Finished and the result is available. */
  SUCCESS("success"),

  /** Failed; the message carries a user-safe description. */
  ERROR("error"),

  /** Stopped at a stage boundary after a cancellation request. */
  CANCELLED("cancelled");

  private final String value;

  TaskStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean isTerminal() {
    return this == SUCCESS || this == ERROR || this == CANCELLED;
  }
}
