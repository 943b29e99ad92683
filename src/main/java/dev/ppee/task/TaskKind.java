package dev.ppee.task;

import com.fasterxml.jackson.annotation.JsonValue;

/** The kind of work a task performs. */
public enum TaskKind {
  SEARCH("search"),
  ANALYSIS("analysis");

  private final String value;

  TaskKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
