package dev.ppee.config;

import dev.ppee.pipeline.TaskSubmissionRejectedException;
import dev.ppee.task.PipelineException;
import dev.ppee.task.TaskNotFoundException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <ul>
 *   <li>{@link IllegalArgumentException} (including search validation) and bean validation: 400
 *   <li>{@link TaskNotFoundException}: 404
 *   <li>{@link TaskSubmissionRejectedException} and backend {@link PipelineException}s: 503
 * </ul>
 *
 * <p>Internal details of 503 responses stay in the log; the body carries the user-safe message.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  ProblemDetail handleInvalidBody(MethodArgumentNotValidException ex) {
    String detail =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining("; "));
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
  }

  @ExceptionHandler(TaskNotFoundException.class)
  ProblemDetail handleTaskNotFound(TaskNotFoundException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(TaskSubmissionRejectedException.class)
  ProblemDetail handleRejected(TaskSubmissionRejectedException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
  }

  @ExceptionHandler(PipelineException.class)
  ProblemDetail handlePipeline(PipelineException ex) {
    log.warn("Backend unavailable while serving request: {}", ex.getMessage(), ex);
    return ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.userMessage());
  }
}
