package dev.ppee.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/** Per-parameter line of an analysis result. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParameterSummary(
    Long parameterId,
    String name,
    boolean success,
    @Nullable String value,
    @Nullable Double confidence,
    @Nullable String error) {

  static ParameterSummary success(Long parameterId, String name, String value, double confidence) {
    return new ParameterSummary(
        parameterId, name, true, value, SearchHit.round(confidence), null);
  }

  static ParameterSummary failure(Long parameterId, String name, String error) {
    return new ParameterSummary(parameterId, name, false, null, null, error);
  }
}
