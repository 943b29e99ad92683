package dev.ppee.extraction;

/**
 * A value extracted from a raw LLM response.
 *
 * @param value the extracted value, or {@link LlmResponseParser#NOT_FOUND_VALUE}
 * @param confidence confidence in [0, 1]
 * @param format which response convention matched, e.g. {@code json} or {@code key_value_exact}
 */
public record ParsedAnswer(String value, double confidence, String format) {

  public static final String FORMAT_EMPTY = "empty";
  public static final String FORMAT_NOT_FOUND = "not_found";

  public ParsedAnswer {
    confidence = Math.max(0.0, Math.min(1.0, confidence));
  }

  /** True when the model reported that the information is absent. */
  public boolean notFound() {
    return FORMAT_EMPTY.equals(format) || FORMAT_NOT_FOUND.equals(format);
  }
}
