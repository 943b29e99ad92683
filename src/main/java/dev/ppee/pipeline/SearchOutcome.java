package dev.ppee.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.ppee.search.SearchMethod;
import java.util.List;
import java.util.stream.IntStream;
import org.jspecify.annotations.Nullable;

/** Result payload of a successful search task. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchOutcome(
    String applicationId,
    String query,
    SearchMethod method,
    int count,
    boolean reranked,
    boolean rerankDegraded,
    List<String> warnings,
    long executionTimeMs,
    List<SearchHit> results,
    @Nullable LlmAnswer llm) {

  static SearchOutcome from(String applicationId, SearchRun run) {
    List<SearchHit> hits =
        IntStream.range(0, run.results().size())
            .mapToObj(i -> SearchHit.from(i + 1, run.results().get(i)))
            .toList();
    return new SearchOutcome(
        applicationId,
        run.query(),
        run.method(),
        hits.size(),
        run.reranked(),
        run.rerankDegraded(),
        run.warnings(),
        run.executionTimeMs(),
        hits,
        run.extraction() != null ? LlmAnswer.from(run.extraction()) : null);
  }
}
