package dev.ppee.llm;

import java.util.List;
import java.util.Optional;

/** Text-generation backend used by the extraction stage. */
public interface LlmClient {

  /**
   * Generates a completion for a prompt.
   *
   * @param model model name
   * @param prompt the full prompt
   * @param temperature sampling temperature
   * @param maxTokens upper bound on generated tokens
   * @return the generated text, possibly empty
   * @throws LlmUnavailableException if the backend cannot be reached or rejects the request
   */
  String generate(String model, String prompt, double temperature, int maxTokens);

  /** Names of the models available on the backend; empty when it cannot be reached. */
  List<String> listModels();

  /** Details of a model; empty when unknown or when the backend cannot be reached. */
  Optional<ModelInfo> modelInfo(String model);
}
