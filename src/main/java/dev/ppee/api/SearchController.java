package dev.ppee.api;

import dev.ppee.llm.ModelInfo;
import dev.ppee.pipeline.SearchTaskService;
import dev.ppee.search.LlmOptions;
import dev.ppee.search.SearchConfiguration;
import dev.ppee.search.SearchConfigurationFactory;
import dev.ppee.task.CancelAcknowledgement;
import dev.ppee.task.TaskStatusPayload;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for submitting searches and analyses, polling and cancelling tasks, and listing
 * LLM models. Submissions answer 202 with the task id; errors are Problem Details produced by
 * {@link dev.ppee.config.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api")
public class SearchController {

  private final SearchTaskService searchTaskService;
  private final SearchConfigurationFactory configurationFactory;

  public SearchController(
      SearchTaskService searchTaskService, SearchConfigurationFactory configurationFactory) {
    this.searchTaskService = searchTaskService;
    this.configurationFactory = configurationFactory;
  }

  @PostMapping("/applications/{applicationId}/search")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public TaskSubmittedResponse submitSearch(
      @PathVariable String applicationId, @Valid @RequestBody SearchRequest request) {
    LlmOptions llm = null;
    if (request.llm() != null) {
      SearchRequest.LlmRequest options = request.llm();
      llm =
          configurationFactory.llmOptions(
              options.model(),
              options.promptTemplate(),
              options.temperature(),
              options.maxTokens(),
              options.llmQuery());
    }
    SearchConfiguration config =
        configurationFactory.create(
            request.searchLimit(),
            request.useReranker(),
            request.rerankLimit(),
            request.useSmartSearch(),
            request.vectorWeight(),
            request.textWeight(),
            request.hybridThreshold(),
            request.useFullScan(),
            llm);
    return TaskSubmittedResponse.of(
        searchTaskService.submitSearch(applicationId, request.query(), config));
  }

  @PostMapping("/applications/{applicationId}/analysis")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public TaskSubmittedResponse submitAnalysis(
      @PathVariable String applicationId, @Valid @RequestBody AnalysisRequest request) {
    return TaskSubmittedResponse.of(
        searchTaskService.submitAnalysis(applicationId, request.checklistId()));
  }

  @GetMapping("/tasks/{taskId}")
  public TaskStatusPayload taskStatus(@PathVariable String taskId) {
    return searchTaskService.getStatus(taskId);
  }

  @PostMapping("/tasks/{taskId}/cancel")
  public CancelAcknowledgement cancel(@PathVariable String taskId) {
    return searchTaskService.cancel(taskId);
  }

  @GetMapping("/llm/models")
  public List<String> listModels() {
    return searchTaskService.listModels();
  }

  @GetMapping("/llm/models/{name}")
  public ResponseEntity<ModelInfo> modelInfo(@PathVariable String name) {
    return ResponseEntity.of(searchTaskService.modelInfo(name));
  }
}
