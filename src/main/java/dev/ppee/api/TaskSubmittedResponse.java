package dev.ppee.api;

/** Returned with 202 Accepted; poll {@code statusUrl} for progress. */
public record TaskSubmittedResponse(String taskId, String statusUrl) {

  static TaskSubmittedResponse of(String taskId) {
    return new TaskSubmittedResponse(taskId, "/api/tasks/" + taskId);
  }
}
