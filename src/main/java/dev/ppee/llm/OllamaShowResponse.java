package dev.ppee.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** JSON response of the Ollama {@code /api/show} endpoint, reduced to the fields we read. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OllamaShowResponse(
    @Nullable Details details, @JsonProperty("model_info") @Nullable Map<String, Object> modelInfo) {

  /** The {@code details} block. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Details(
      @Nullable String family,
      @JsonProperty("parameter_size") @Nullable String parameterSize,
      @JsonProperty("quantization_level") @Nullable String quantizationLevel) {}
}
