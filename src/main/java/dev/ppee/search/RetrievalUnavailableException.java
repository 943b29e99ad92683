package dev.ppee.search;

import dev.ppee.task.PipelineException;

/** The embedding model, the vector index or the lexical index could not be queried. */
public class RetrievalUnavailableException extends PipelineException {

  public RetrievalUnavailableException(String message, Throwable cause) {
    super("Search index is unavailable, please try again later", message, cause);
  }
}
