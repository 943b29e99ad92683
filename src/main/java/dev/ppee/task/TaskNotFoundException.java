package dev.ppee.task;

/** Thrown when a task id is unknown or its entry has already been evicted. */
public class TaskNotFoundException extends RuntimeException {

  public TaskNotFoundException(String taskId) {
    super("Task not found: " + taskId);
  }
}
