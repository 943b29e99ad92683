package dev.ppee.task;

/** Thrown at a stage boundary when the running task has been asked to stop. */
public class TaskCancelledException extends RuntimeException {

  public TaskCancelledException(String taskId) {
    super("Task " + taskId + " was cancelled");
  }
}
