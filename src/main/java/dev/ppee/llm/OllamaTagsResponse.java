package dev.ppee.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** JSON response of the Ollama {@code /api/tags} endpoint. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OllamaTagsResponse(List<Model> models) {

  public OllamaTagsResponse {
    models = models == null ? List.of() : List.copyOf(models);
  }

  /** A locally available model. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Model(String name) {}
}
