package dev.ppee.search;

import dev.ppee.task.PipelineException;

/** The cross-encoder failed to score a candidate set. Never escapes {@link RerankerService}. */
public class RerankUnavailableException extends PipelineException {

  public RerankUnavailableException(String message, Throwable cause) {
    super("Reranking was unavailable; results are in retrieval order", message, cause);
  }

  public RerankUnavailableException(String message) {
    super("Reranking was unavailable; results are in retrieval order", message);
  }
}
