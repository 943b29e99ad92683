package dev.ppee.pipeline;

import dev.ppee.extraction.ExtractionRequest;
import dev.ppee.extraction.ExtractionResult;
import dev.ppee.extraction.ExtractionService;
import dev.ppee.search.ChunkRetriever;
import dev.ppee.search.RerankOutcome;
import dev.ppee.search.RerankerService;
import dev.ppee.search.RetrievalCandidate;
import dev.ppee.search.RetrievalStrategy;
import dev.ppee.search.RetrievalStrategySelector;
import dev.ppee.search.SearchConfiguration;
import dev.ppee.task.TaskStage;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one search through its stages: strategy selection, retrieval, optional reranking and
 * optional LLM extraction.
 *
 * <p>Every stage boundary goes through the {@link StageReporter}, which is where cancellation is
 * observed. The LLM stage additionally checks between full-scan batches.
 */
@Service
public class SearchPipeline {

  private static final Logger log = LoggerFactory.getLogger(SearchPipeline.class);

  private final RetrievalStrategySelector strategySelector;
  private final ChunkRetriever chunkRetriever;
  private final RerankerService rerankerService;
  private final ExtractionService extractionService;

  public SearchPipeline(
      RetrievalStrategySelector strategySelector,
      ChunkRetriever chunkRetriever,
      RerankerService rerankerService,
      ExtractionService extractionService) {
    this.strategySelector = strategySelector;
    this.chunkRetriever = chunkRetriever;
    this.rerankerService = rerankerService;
    this.extractionService = extractionService;
  }

  /**
   * Executes the search.
   *
   * @param applicationId the application whose documents are searched
   * @param query the search query
   * @param config validated search configuration
   * @param reporter receives stage transitions and decides cancellation
   * @return results and diagnostics of this run
   * @throws dev.ppee.task.TaskCancelledException if cancellation was requested
   * @throws dev.ppee.search.RetrievalUnavailableException if the index cannot be queried
   * @throws dev.ppee.llm.LlmUnavailableException if the LLM stage cannot reach the model
   */
  public SearchRun execute(
      String applicationId, String query, SearchConfiguration config, StageReporter reporter) {
    long start = System.nanoTime();
    reporter.enter(TaskStage.STARTING, "Starting search");

    reporter.enter(TaskStage.INITIALIZING, "Selecting search strategy");
    RetrievalStrategy strategy = strategySelector.select(query, config);
    int fetchLimit = fetchLimit(applicationId, config);
    log.debug(
        "Search '{}' in application {}: method={}, fetchLimit={}",
        query,
        applicationId,
        strategy.method().value(),
        fetchLimit);

    TaskStage retrievalStage =
        strategy.isHybrid() ? TaskStage.HYBRID_SEARCH : TaskStage.VECTOR_SEARCH;
    reporter.enter(retrievalStage, "Running " + strategy.method().value() + " search");
    List<RetrievalCandidate> candidates =
        chunkRetriever.retrieve(applicationId, query, strategy, fetchLimit);

    List<String> warnings = new ArrayList<>();
    boolean degraded = false;
    if (config.useReranker()) {
      reporter.enter(
          TaskStage.RERANKING, "Reranking " + candidates.size() + " candidates");
      RerankOutcome outcome =
          rerankerService.rerank(query, candidates, config.rerankLimit(), config.searchLimit());
      candidates = outcome.candidates();
      degraded = outcome.degraded();
      if (outcome.warning() != null) {
        warnings.add(outcome.warning());
      }
    } else {
      candidates = candidates.stream().limit(config.searchLimit()).toList();
    }

    ExtractionResult extraction = null;
    if (config.usesLlm()) {
      reporter.enter(TaskStage.LLM_PROCESSING, "Extracting answer with " + config.llm().model());
      extraction =
          extractionService.extract(
              new ExtractionRequest(
                  applicationId,
                  query,
                  candidates,
                  strategy.method(),
                  config.llm(),
                  config.useFullScan()),
              reporter);
    }

    reporter.enter(TaskStage.FINISHING, "Preparing " + candidates.size() + " results");
    long elapsedMs = (System.nanoTime() - start) / 1_000_000;
    log.info(
        "Search in application {} returned {} results in {} ms (method={}, reranked={})",
        applicationId,
        candidates.size(),
        elapsedMs,
        strategy.method().value(),
        config.useReranker());
    return new SearchRun(
        query,
        strategy.method(),
        candidates,
        config.useReranker(),
        degraded,
        warnings,
        extraction,
        elapsedMs);
  }

  /**
   * Number of candidates retrieved before reranking and truncation. Rerank "all" fetches every
   * chunk of the application.
   */
  int fetchLimit(String applicationId, SearchConfiguration config) {
    if (!config.useReranker()) {
      return config.searchLimit();
    }
    if (config.rerankAll()) {
      return Math.max(chunkRetriever.countChunks(applicationId), config.searchLimit());
    }
    return Math.max(config.searchLimit(), config.rerankLimit());
  }

  /** Stages a search with this strategy and configuration goes through, in order. */
  static List<TaskStage> plannedStages(RetrievalStrategy strategy, SearchConfiguration config) {
    List<TaskStage> stages = new ArrayList<>();
    stages.add(TaskStage.STARTING);
    stages.add(TaskStage.INITIALIZING);
    stages.add(strategy.isHybrid() ? TaskStage.HYBRID_SEARCH : TaskStage.VECTOR_SEARCH);
    if (config.useReranker()) {
      stages.add(TaskStage.RERANKING);
    }
    if (config.usesLlm()) {
      stages.add(TaskStage.LLM_PROCESSING);
    }
    stages.add(TaskStage.FINISHING);
    stages.add(TaskStage.COMPLETE);
    return List.copyOf(stages);
  }
}
