package dev.ppee.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.ppee.checklist.Checklist;
import dev.ppee.checklist.ChecklistParameter;
import dev.ppee.checklist.ParameterResult;
import dev.ppee.checklist.ParameterResultRepository;
import dev.ppee.extraction.ExtractionResult;
import dev.ppee.search.LlmOptions;
import dev.ppee.search.SearchConfiguration;
import dev.ppee.search.SearchConfigurationFactory;
import dev.ppee.task.PipelineException;
import dev.ppee.task.TaskCancelledException;
import dev.ppee.task.TaskStage;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs every parameter of a checklist against one application and stores the answers.
 *
 * <p>Each parameter is a full search with LLM extraction, configured from the parameter row. A
 * failing parameter is logged, counted and skipped; the analysis goes on with the next one.
 * Cancellation stops the whole analysis and is checked again right before each result is stored,
 * so nothing is written after a cancel was observed.
 *
 * <p>Results are upserted per (application, parameter).
 */
@Service
public class AnalysisPipeline {

  private static final Logger log = LoggerFactory.getLogger(AnalysisPipeline.class);

  static final int ANALYSIS_PROGRESS_START = 15;
  static final int ANALYSIS_PROGRESS_SPAN = 75;

  private final SearchPipeline searchPipeline;
  private final SearchConfigurationFactory configurationFactory;
  private final ParameterResultRepository resultRepository;
  private final ObjectMapper objectMapper;

  public AnalysisPipeline(
      SearchPipeline searchPipeline,
      SearchConfigurationFactory configurationFactory,
      ParameterResultRepository resultRepository,
      ObjectMapper objectMapper) {
    this.searchPipeline = searchPipeline;
    this.configurationFactory = configurationFactory;
    this.resultRepository = resultRepository;
    this.objectMapper = objectMapper;
  }

  /**
   * Analyses the application with every parameter of the checklist, in order.
   *
   * @throws TaskCancelledException if cancellation was requested
   */
  public AnalysisOutcome execute(
      String applicationId,
      Checklist checklist,
      List<ChecklistParameter> parameters,
      StageReporter reporter) {
    int total = parameters.size();
    reporter.enter(TaskStage.STARTING, "Starting analysis of " + total + " parameters");
    reporter.enter(TaskStage.INITIALIZING, "Loaded checklist '" + checklist.getName() + "'");

    int processed = 0;
    int errors = 0;
    List<ParameterSummary> summaries = new ArrayList<>(total);

    for (int i = 0; i < total; i++) {
      ChecklistParameter parameter = parameters.get(i);
      reporter.enter(
          TaskStage.ANALYZING,
          progressAt(i, total),
          "Analyzing parameter %d of %d: %s".formatted(i + 1, total, parameter.getName()));
      try {
        SearchConfiguration config = configurationFor(parameter);
        SearchRun run =
            searchPipeline.execute(
                applicationId,
                parameter.getSearchQuery(),
                config,
                new ParameterStageReporter(reporter, parameter.getName()));
        ExtractionResult extraction = run.extraction();
        if (extraction == null) {
          throw new IllegalStateException(
              "Search for parameter " + parameter.getId() + " ran without an LLM stage");
        }
        reporter.throwIfCancelled();
        store(applicationId, parameter, config, run, extraction);
        processed++;
        summaries.add(
            ParameterSummary.success(
                parameter.getId(),
                parameter.getName(),
                extraction.value(),
                extraction.confidence()));
      } catch (TaskCancelledException e) {
        throw e;
      } catch (RuntimeException e) {
        errors++;
        log.error(
            "Parameter {} ('{}') of application {} failed",
            parameter.getId(),
            parameter.getName(),
            applicationId,
            e);
        summaries.add(
            ParameterSummary.failure(parameter.getId(), parameter.getName(), errorMessage(e)));
      }
    }

    reporter.enter(
        TaskStage.FINISHING,
        "Analysis finished: %d of %d parameters processed, %d errors"
            .formatted(processed, total, errors));
    log.info(
        "Analysis of application {} with checklist {}: {} processed, {} errors",
        applicationId,
        checklist.getId(),
        processed,
        errors);
    return new AnalysisOutcome(
        applicationId, checklist.getId(), processed, errors, total, summaries);
  }

  static int progressAt(int index, int total) {
    return ANALYSIS_PROGRESS_START + ANALYSIS_PROGRESS_SPAN * index / total;
  }

  SearchConfiguration configurationFor(ChecklistParameter parameter) {
    LlmOptions llm =
        configurationFactory.llmOptions(
            parameter.getLlmModel(),
            parameter.getLlmPromptTemplate(),
            parameter.getLlmTemperature(),
            parameter.getLlmMaxTokens(),
            parameter.getLlmQuery());
    Integer rerankLimit = parameter.getRerankLimit();
    String rawRerankLimit;
    if (rerankLimit == null) {
      rawRerankLimit = null;
    } else if (rerankLimit <= 0) {
      rawRerankLimit = "all";
    } else {
      rawRerankLimit = rerankLimit.toString();
    }
    return configurationFactory.create(
        parameter.getSearchLimit(),
        parameter.isUseReranker(),
        rawRerankLimit,
        null,
        null,
        null,
        null,
        parameter.isUseFullScan(),
        llm);
  }

  private void store(
      String applicationId,
      ChecklistParameter parameter,
      SearchConfiguration config,
      SearchRun run,
      ExtractionResult extraction) {
    List<SearchHit> hits =
        IntStream.range(0, run.results().size())
            .mapToObj(i -> SearchHit.from(i + 1, run.results().get(i)))
            .toList();
    ParameterResult result =
        resultRepository
            .findByApplicationIdAndParameterId(applicationId, parameter.getId())
            .orElseGet(() -> new ParameterResult(applicationId, parameter.getId()));
    result.update(
        extraction.value(),
        extraction.confidence(),
        toJson(hits),
        toJson(llmRequest(parameter, config, run, extraction)));
    resultRepository.save(result);
  }

  private static Map<String, Object> llmRequest(
      ChecklistParameter parameter,
      SearchConfiguration config,
      SearchRun run,
      ExtractionResult extraction) {
    LlmOptions llm = config.llm();
    Map<String, Object> request = new LinkedHashMap<>();
    request.put("search_query", parameter.getSearchQuery());
    if (llm != null) {
      request.put("llm_query", llm.effectiveQuery(parameter.getSearchQuery()));
      request.put("model", llm.model());
      request.put("temperature", llm.temperature());
      request.put("max_tokens", llm.maxTokens());
    }
    request.put("search_method", run.method().value());
    request.put("extraction_method", extraction.method().value());
    request.put("chunks_scanned", extraction.chunksScanned());
    request.put("response_format", extraction.responseFormat());
    request.put("prompt", extraction.prompt());
    request.put("response", extraction.rawResponse());
    return request;
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialise analysis result", e);
    }
  }

  private static String errorMessage(RuntimeException e) {
    if (e instanceof PipelineException pipelineException) {
      return pipelineException.userMessage();
    }
    if (e instanceof IllegalArgumentException) {
      return e.getMessage();
    }
    return TaskRunner.GENERIC_ERROR;
  }

  /** Nested reporter for one parameter: observes cancellation, leaves the task stage alone. */
  private static final class ParameterStageReporter implements StageReporter {

    private final StageReporter parent;
    private final String parameterName;

    ParameterStageReporter(StageReporter parent, @Nullable String parameterName) {
      this.parent = parent;
      this.parameterName = parameterName;
    }

    @Override
    public void enter(TaskStage stage, int progress, String message) {
      parent.throwIfCancelled();
      log.debug("Parameter '{}' -> {}: {}", parameterName, stage.value(), message);
    }

    @Override
    public void throwIfCancelled() {
      parent.throwIfCancelled();
    }
  }
}
