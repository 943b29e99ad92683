package dev.ppee.pipeline;

import dev.ppee.extraction.ExtractionResult;
import dev.ppee.search.SearchMethod;

/** The LLM stage result as shown to clients. */
public record LlmAnswer(
    String value,
    double confidence,
    SearchMethod method,
    int chunksScanned,
    int sourceCount,
    String responseFormat) {

  static LlmAnswer from(ExtractionResult extraction) {
    return new LlmAnswer(
        extraction.value(),
        SearchHit.round(extraction.confidence()),
        extraction.method(),
        extraction.chunksScanned(),
        extraction.sourceCandidates().size(),
        extraction.responseFormat());
  }
}
