package dev.ppee.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.ppee.pipeline.SearchTaskService;
import dev.ppee.pipeline.TaskSubmissionRejectedException;
import dev.ppee.search.LlmOptions;
import dev.ppee.search.SearchConfiguration;
import dev.ppee.search.SearchConfigurationFactory;
import dev.ppee.task.CancelAcknowledgement;
import dev.ppee.task.PipelineException;
import dev.ppee.task.TaskNotFoundException;
import dev.ppee.task.TaskStatusPayload;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing search, analysis and task control as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: exceptions are caught and returned as descriptive
 * error strings, never thrown. Unexpected failures are logged and reported without their detail.
 *
 * <p>Tools: {@code search_documents}, {@code analyze_application}, {@code task_status}, {@code
 * cancel_task}, {@code list_llm_models}.
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  private static final String INTERNAL_ERROR = "internal error, see server logs.";

  private final SearchTaskService searchTaskService;
  private final SearchConfigurationFactory configurationFactory;
  private final ObjectMapper objectMapper;

  public McpToolService(
      SearchTaskService searchTaskService,
      SearchConfigurationFactory configurationFactory,
      ObjectMapper objectMapper) {
    this.searchTaskService = searchTaskService;
    this.configurationFactory = configurationFactory;
    this.objectMapper = objectMapper;
  }

  /** Submits an asynchronous search over the documents of one application. */
  @Tool(
      name = "search_documents",
      description =
          "Search the documents of an application. Runs asynchronously: returns a task ID, "
              + "poll it with task_status. Optionally reranks results and extracts an answer "
              + "with an LLM.")
  public String searchDocuments(
      @ToolParam(description = "Application ID whose documents are searched") @Nullable
          String applicationId,
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "Number of results (1-100, default 5)", required = false)
          @Nullable Integer searchLimit,
      @ToolParam(description = "Rerank results with the cross-encoder", required = false)
          @Nullable Boolean useReranker,
      @ToolParam(
              description = "How many candidates the reranker scores: a number or 'all'",
              required = false)
          @Nullable String rerankLimit,
      @ToolParam(
              description = "Use hybrid (vector + full-text) search for short queries",
              required = false)
          @Nullable Boolean useSmartSearch,
      @ToolParam(description = "Extract an answer with the LLM", required = false)
          @Nullable Boolean useLlm,
      @ToolParam(description = "LLM model name, e.g. 'gemma3:27b'", required = false)
          @Nullable String llmModel,
      @ToolParam(
              description = "Question asked to the LLM instead of the search query",
              required = false)
          @Nullable String llmQuery,
      @ToolParam(
              description = "Scan every chunk with the LLM when the ranked results have no answer",
              required = false)
          @Nullable Boolean useFullScan) {
    try {
      if (applicationId == null || applicationId.isBlank()) {
        return "Error: Application ID must not be empty.";
      }
      if (query == null || query.isBlank()) {
        return "Error: Query must not be empty. Provide a search query string.";
      }
      LlmOptions llm =
          Boolean.TRUE.equals(useLlm)
              ? configurationFactory.llmOptions(llmModel, null, null, null, llmQuery)
              : null;
      SearchConfiguration config =
          configurationFactory.create(
              searchLimit,
              useReranker,
              rerankLimit,
              useSmartSearch,
              null,
              null,
              null,
              useFullScan,
              llm);
      String taskId = searchTaskService.submitSearch(applicationId, query, config);
      return "Search task %s submitted. Check progress with task_status.".formatted(taskId);
    } catch (IllegalArgumentException | TaskSubmissionRejectedException e) {
      return "Error: " + e.getMessage();
    } catch (PipelineException e) {
      log.warn("search_documents failed: {}", e.getMessage(), e);
      return "Error submitting search: " + e.userMessage();
    } catch (Exception e) {
      log.warn("search_documents failed: {}", e.getMessage(), e);
      return "Error submitting search: " + INTERNAL_ERROR;
    }
  }

  /** Submits an asynchronous checklist analysis of one application. */
  @Tool(
      name = "analyze_application",
      description =
          "Analyze an application with a checklist: every checklist parameter is searched and "
              + "answered by the LLM, results are stored. Returns a task ID for task_status.")
  public String analyzeApplication(
      @ToolParam(description = "Application ID to analyze") @Nullable String applicationId,
      @ToolParam(description = "Checklist ID") @Nullable Long checklistId) {
    try {
      if (applicationId == null || applicationId.isBlank()) {
        return "Error: Application ID must not be empty.";
      }
      if (checklistId == null) {
        return "Error: Checklist ID must not be empty.";
      }
      String taskId = searchTaskService.submitAnalysis(applicationId, checklistId);
      return "Analysis task %s submitted. Check progress with task_status.".formatted(taskId);
    } catch (IllegalArgumentException | TaskSubmissionRejectedException e) {
      return "Error: " + e.getMessage();
    } catch (PipelineException e) {
      log.warn("analyze_application failed: {}", e.getMessage(), e);
      return "Error submitting analysis: " + e.userMessage();
    } catch (Exception e) {
      log.warn("analyze_application failed: {}", e.getMessage(), e);
      return "Error submitting analysis: " + INTERNAL_ERROR;
    }
  }

  /** Reports status, stage, progress and, once finished, the result of a task. */
  @Tool(
      name = "task_status",
      description =
          "Check the status, stage and progress of a search or analysis task. "
              + "Includes the result once the task succeeded.")
  public String taskStatus(@ToolParam(description = "Task ID") @Nullable String taskId) {
    try {
      if (taskId == null || taskId.isBlank()) {
        return "Error: Task ID must not be empty.";
      }
      return formatStatus(searchTaskService.getStatus(taskId));
    } catch (TaskNotFoundException e) {
      return "Error: Task %s not found or expired.".formatted(taskId);
    } catch (Exception e) {
      log.warn("task_status failed for {}: {}", taskId, e.getMessage(), e);
      return "Error checking task status: " + INTERNAL_ERROR;
    }
  }

  /** Requests cancellation of a running task. */
  @Tool(
      name = "cancel_task",
      description =
          "Cancel a running search or analysis task. The task stops at its next stage boundary.")
  public String cancelTask(@ToolParam(description = "Task ID") @Nullable String taskId) {
    try {
      if (taskId == null || taskId.isBlank()) {
        return "Error: Task ID must not be empty.";
      }
      CancelAcknowledgement ack = searchTaskService.cancel(taskId);
      return "Task %s (%s): %s".formatted(ack.taskId(), ack.status().value(), ack.message());
    } catch (TaskNotFoundException e) {
      return "Error: Task %s not found or expired.".formatted(taskId);
    } catch (Exception e) {
      log.warn("cancel_task failed for {}: {}", taskId, e.getMessage(), e);
      return "Error cancelling task: " + INTERNAL_ERROR;
    }
  }

  /** Lists generation models available on the LLM server. */
  @Tool(name = "list_llm_models", description = "List the LLM models available for extraction.")
  public String listLlmModels() {
    try {
      List<String> models = searchTaskService.listModels();
      if (models.isEmpty()) {
        return "No LLM models available. The model server may be unreachable.";
      }
      StringBuilder sb = new StringBuilder();
      for (String model : models) {
        sb.append("- ").append(model).append(System.lineSeparator());
      }
      return sb.toString();
    } catch (PipelineException e) {
      log.warn("list_llm_models failed: {}", e.getMessage(), e);
      return "Error listing models: " + e.userMessage();
    } catch (Exception e) {
      log.warn("list_llm_models failed: {}", e.getMessage(), e);
      return "Error listing models: " + INTERNAL_ERROR;
    }
  }

  private String formatStatus(TaskStatusPayload status) throws JsonProcessingException {
    StringBuilder sb = new StringBuilder();
    sb.append(String.format("Task: %s (%s)%n", status.taskId(), status.kind().value()));
    sb.append(String.format("Status: %s%n", status.status().value()));
    sb.append(String.format("Stage: %s (%d%%)%n", status.stage().value(), status.progress()));
    sb.append(String.format("Message: %s%n", status.message()));
    if (status.result() != null) {
      sb.append("Result:").append(System.lineSeparator());
      sb.append(
          objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(status.result()));
    }
    return sb.toString();
  }
}
