package dev.ppee.task;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The polling payload returned to clients for a task.
 *
 * <p>{@code result} is only present once the task finished successfully.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskStatusPayload(
    String taskId,
    TaskKind kind,
    TaskStatus status,
    TaskStage stage,
    int progress,
    String message,
    List<TaskStage> stages,
    boolean cancelRequested,
    @Nullable Object result) {

  public static TaskStatusPayload from(TaskSnapshot snapshot) {
    return new TaskStatusPayload(
        snapshot.id(),
        snapshot.kind(),
        snapshot.status(),
        snapshot.stage(),
        snapshot.progress(),
        snapshot.message(),
        snapshot.stages(),
        snapshot.cancelRequested(),
        snapshot.status() == TaskStatus.SUCCESS ? snapshot.result() : null);
  }
}
