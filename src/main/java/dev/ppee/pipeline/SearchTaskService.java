package dev.ppee.pipeline;

import dev.ppee.checklist.Checklist;
import dev.ppee.checklist.ChecklistParameter;
import dev.ppee.checklist.ChecklistParameterRepository;
import dev.ppee.checklist.ChecklistRepository;
import dev.ppee.llm.LlmClient;
import dev.ppee.llm.ModelInfo;
import dev.ppee.search.RetrievalStrategy;
import dev.ppee.search.RetrievalStrategySelector;
import dev.ppee.search.SearchConfiguration;
import dev.ppee.search.SearchValidationException;
import dev.ppee.task.CancelAcknowledgement;
import dev.ppee.task.TaskKind;
import dev.ppee.task.TaskNotFoundException;
import dev.ppee.task.TaskRegistry;
import dev.ppee.task.TaskSnapshot;
import dev.ppee.task.TaskStage;
import dev.ppee.task.TaskStatusPayload;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Entry point shared by the REST API and the MCP tools: validates requests, registers tasks and
 * hands them to the worker pool, and answers status, cancel and model queries.
 *
 * <p>Validation happens before a task exists, so an invalid request never leaves a task behind.
 * If the worker pool rejects the task, the registry entry is removed again.
 */
@Service
public class SearchTaskService {

  private static final Logger log = LoggerFactory.getLogger(SearchTaskService.class);

  private static final List<TaskStage> ANALYSIS_STAGES =
      List.of(
          TaskStage.STARTING,
          TaskStage.INITIALIZING,
          TaskStage.ANALYZING,
          TaskStage.FINISHING,
          TaskStage.COMPLETE);

  private final TaskRegistry registry;
  private final TaskRunner taskRunner;
  private final TaskExecutor taskExecutor;
  private final RetrievalStrategySelector strategySelector;
  private final SearchPipeline searchPipeline;
  private final AnalysisPipeline analysisPipeline;
  private final ChecklistRepository checklistRepository;
  private final ChecklistParameterRepository parameterRepository;
  private final LlmClient llmClient;
  private final String embeddingModelName;

  public SearchTaskService(
      TaskRegistry registry,
      TaskRunner taskRunner,
      @Qualifier("searchTaskExecutor") TaskExecutor taskExecutor,
      RetrievalStrategySelector strategySelector,
      SearchPipeline searchPipeline,
      AnalysisPipeline analysisPipeline,
      ChecklistRepository checklistRepository,
      ChecklistParameterRepository parameterRepository,
      LlmClient llmClient,
      @Value("${ppee.embedding.model-name:bge-m3}") String embeddingModelName) {
    this.registry = registry;
    this.taskRunner = taskRunner;
    this.taskExecutor = taskExecutor;
    this.strategySelector = strategySelector;
    this.searchPipeline = searchPipeline;
    this.analysisPipeline = analysisPipeline;
    this.checklistRepository = checklistRepository;
    this.parameterRepository = parameterRepository;
    this.llmClient = llmClient;
    this.embeddingModelName = embeddingModelName;
  }

  /**
   * Validates and schedules a search.
   *
   * @return the id of the new task
   * @throws SearchValidationException if the application id or query is blank
   * @throws TaskSubmissionRejectedException if the worker pool is saturated
   */
  public String submitSearch(String applicationId, String query, SearchConfiguration config) {
    requireApplicationId(applicationId);
    RetrievalStrategy strategy = strategySelector.select(query, config);
    TaskSnapshot task =
        registry.create(TaskKind.SEARCH, SearchPipeline.plannedStages(strategy, config));
    schedule(
        task.id(),
        reporter ->
            SearchOutcome.from(
                applicationId, searchPipeline.execute(applicationId, query, config, reporter)));
    log.info(
        "Search task {} submitted for application {} (method={})",
        task.id(),
        applicationId,
        strategy.method().value());
    return task.id();
  }

  /**
   * Validates and schedules an analysis of the application with a checklist.
   *
   * @return the id of the new task
   * @throws SearchValidationException if the checklist does not exist or has no parameters
   * @throws TaskSubmissionRejectedException if the worker pool is saturated
   */
  public String submitAnalysis(String applicationId, Long checklistId) {
    requireApplicationId(applicationId);
    if (checklistId == null) {
      throw new SearchValidationException("Checklist id must not be null");
    }
    Checklist checklist =
        checklistRepository
            .findById(checklistId)
            .orElseThrow(
                () -> new SearchValidationException("Checklist not found: " + checklistId));
    List<ChecklistParameter> parameters =
        parameterRepository.findByChecklistIdOrderByOrderIndexAscIdAsc(checklistId);
    if (parameters.isEmpty()) {
      throw new SearchValidationException("Checklist " + checklistId + " has no parameters");
    }

    TaskSnapshot task = registry.create(TaskKind.ANALYSIS, ANALYSIS_STAGES);
    schedule(
        task.id(),
        reporter -> analysisPipeline.execute(applicationId, checklist, parameters, reporter));
    log.info(
        "Analysis task {} submitted for application {} with checklist {} ({} parameters)",
        task.id(),
        applicationId,
        checklistId,
        parameters.size());
    return task.id();
  }

  /**
   * Returns the polling payload of a task.
   *
   * @throws TaskNotFoundException if the task is unknown or was evicted
   */
  public TaskStatusPayload getStatus(String taskId) {
    return registry
        .get(taskId)
        .map(TaskStatusPayload::from)
        .orElseThrow(() -> new TaskNotFoundException(taskId));
  }

  /**
   * Requests cancellation of a task. Idempotent; finished tasks are left untouched.
   *
   * @throws TaskNotFoundException if the task is unknown or was evicted
   */
  public CancelAcknowledgement cancel(String taskId) {
    CancelAcknowledgement ack =
        registry.requestCancel(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    log.info("Cancel requested for task {}: {}", taskId, ack.message());
    return ack;
  }

  /** Generation models offered by the inference server; the embedding model is left out. */
  public List<String> listModels() {
    String embeddingPrefix = embeddingModelName.toLowerCase(Locale.ROOT);
    return llmClient.listModels().stream()
        .filter(name -> !name.toLowerCase(Locale.ROOT).startsWith(embeddingPrefix))
        .toList();
  }

  public Optional<ModelInfo> modelInfo(String model) {
    if (model == null || model.isBlank()) {
      throw new SearchValidationException("Model name must not be empty");
    }
    return llmClient.modelInfo(model);
  }

  private void schedule(String taskId, Function<StageReporter, Object> work) {
    try {
      taskExecutor.execute(() -> taskRunner.run(taskId, work));
    } catch (TaskRejectedException e) {
      registry.remove(taskId);
      log.warn("Worker pool rejected task {}: {}", taskId, e.getMessage());
      throw new TaskSubmissionRejectedException(
          "Too many tasks in progress, please try again later", e);
    }
  }

  private static void requireApplicationId(String applicationId) {
    if (applicationId == null || applicationId.isBlank()) {
      throw new SearchValidationException("Application id must not be empty");
    }
  }
}
