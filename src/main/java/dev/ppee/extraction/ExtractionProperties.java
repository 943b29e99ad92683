package dev.ppee.extraction;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the LLM extraction stage.
 *
 * <p>Properties are bound from {@code ppee.extraction.*} in application.yml.
 *
 * <ul>
 *   <li>{@code context-token-budget} - token budget of a prompt when the model does not report a
 *       smaller context window (default 8192)
 *   <li>{@code reserved-prompt-tokens} - tokens kept free for the template and the answer
 *       (default 500)
 *   <li>{@code full-scan-batch-size} - chunks per LLM call during a full scan (default 1)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "ppee.extraction")
public class ExtractionProperties {

  private int contextTokenBudget = 8192;
  private int reservedPromptTokens = 500;
  private int fullScanBatchSize = 1;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (contextTokenBudget < 512) {
      throw new IllegalStateException(
          "ppee.extraction.context-token-budget must be >= 512, got: " + contextTokenBudget);
    }
    if (reservedPromptTokens < 0 || reservedPromptTokens >= contextTokenBudget) {
      throw new IllegalStateException(
          "ppee.extraction.reserved-prompt-tokens must be in [0, context-token-budget), got: "
              + reservedPromptTokens);
    }
    if (fullScanBatchSize < 1) {
      throw new IllegalStateException(
          "ppee.extraction.full-scan-batch-size must be >= 1, got: " + fullScanBatchSize);
    }
  }

  public int getContextTokenBudget() {
    return contextTokenBudget;
  }

  public void setContextTokenBudget(int contextTokenBudget) {
    this.contextTokenBudget = contextTokenBudget;
  }

  public int getReservedPromptTokens() {
    return reservedPromptTokens;
  }

  public void setReservedPromptTokens(int reservedPromptTokens) {
    this.reservedPromptTokens = reservedPromptTokens;
  }

  public int getFullScanBatchSize() {
    return fullScanBatchSize;
  }

  public void setFullScanBatchSize(int fullScanBatchSize) {
    this.fullScanBatchSize = fullScanBatchSize;
  }
}
