package dev.ppee.task;

/**
 * Answer to a cancellation request.
 *
 * @param taskId the task the request was addressed to
 * @param status the task's status at the time of the request
 * @param cancelRequested true once the flag is set; stays true on repeated requests
 * @param message what the client should expect next
 */
public record CancelAcknowledgement(
    String taskId, TaskStatus status, boolean cancelRequested, String message) {}
