package dev.ppee.extraction;

import dev.ppee.search.RetrievalCandidate;
import dev.ppee.search.SearchMethod;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of the extraction stage.
 *
 * @param value the extracted value, or the not-found value
 * @param confidence confidence in [0, 1]
 * @param sourceCandidates candidates the answer was drawn from, in ranked or document order
 * @param method vector, hybrid or full_scan
 * @param chunksScanned number of chunks put in front of the model
 * @param rawResponse the model's last raw answer, null when the model was never called
 * @param responseFormat which answer convention the parser matched
 * @param prompt the last prompt sent, null when the model was never called
 */
public record ExtractionResult(
    String value,
    double confidence,
    List<RetrievalCandidate> sourceCandidates,
    SearchMethod method,
    int chunksScanned,
    @Nullable String rawResponse,
    String responseFormat,
    @Nullable String prompt) {

  public ExtractionResult {
    if (confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("confidence must be in [0, 1], got: " + confidence);
    }
    sourceCandidates = List.copyOf(sourceCandidates);
  }

  public boolean found() {
    return !LlmResponseParser.NOT_FOUND_VALUE.equals(value);
  }
}
