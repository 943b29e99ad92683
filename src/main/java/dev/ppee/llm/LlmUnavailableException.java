package dev.ppee.llm;

import dev.ppee.task.PipelineException;

/** The LLM server could not produce a completion, after retries where they apply. */
public class LlmUnavailableException extends PipelineException {

  public LlmUnavailableException(String message, Throwable cause) {
    super("The language model is unavailable, please try again later", message, cause);
  }

  public LlmUnavailableException(String message) {
    super("The language model is unavailable, please try again later", message);
  }
}
