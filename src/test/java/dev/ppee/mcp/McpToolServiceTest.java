package dev.ppee.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.ppee.llm.LlmUnavailableException;
import dev.ppee.pipeline.SearchTaskService;
import dev.ppee.pipeline.TaskSubmissionRejectedException;
import dev.ppee.search.SearchConfiguration;
import dev.ppee.search.SearchConfigurationFactory;
import dev.ppee.search.SearchProperties;
import dev.ppee.search.SearchValidationException;
import dev.ppee.task.CancelAcknowledgement;
import dev.ppee.task.TaskKind;
import dev.ppee.task.TaskNotFoundException;
import dev.ppee.task.TaskStage;
import dev.ppee.task.TaskStatus;
import dev.ppee.task.TaskStatusPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class McpToolServiceTest {

    @Mock
    SearchTaskService searchTaskService;

    @Captor
    ArgumentCaptor<SearchConfiguration> configCaptor;

    McpToolService mcpToolService;

    @BeforeEach
    void setUp() {
        mcpToolService = new McpToolService(
                searchTaskService,
                new SearchConfigurationFactory(new SearchProperties()),
                new ObjectMapper());
    }

    private static TaskStatusPayload status(TaskStatus status, TaskStage stage, int progress, Object result) {
        return new TaskStatusPayload("t-1", TaskKind.SEARCH, status, stage, progress, "msg",
                List.of(TaskStage.STARTING, TaskStage.VECTOR_SEARCH, TaskStage.COMPLETE), false, result);
    }

    // --- search_documents ---

    @Test
    void searchDocumentsReturnsTaskId() {
        given(searchTaskService.submitSearch(eq("app-1"), eq("устав"), any())).willReturn("t-1");

        String output = mcpToolService.searchDocuments(
                "app-1", "устав", null, null, null, null, null, null, null, null);

        assertThat(output).contains("t-1").contains("task_status");
    }

    @Test
    void searchDocumentsWithoutLlmHasNoLlmStage() {
        given(searchTaskService.submitSearch(anyString(), anyString(), configCaptor.capture()))
                .willReturn("t-1");

        mcpToolService.searchDocuments("app-1", "устав", 7, true, "all", false, null, null, null, null);

        SearchConfiguration config = configCaptor.getValue();
        assertThat(config.searchLimit()).isEqualTo(7);
        assertThat(config.rerankAll()).isTrue();
        assertThat(config.useSmartSearch()).isFalse();
        assertThat(config.llm()).isNull();
    }

    @Test
    void searchDocumentsWithLlmUsesDefaultsForMissingOptions() {
        given(searchTaskService.submitSearch(anyString(), anyString(), configCaptor.capture()))
                .willReturn("t-1");

        mcpToolService.searchDocuments(
                "app-1", "устав", null, null, null, null, true, null, "Какая форма?", true);

        SearchConfiguration config = configCaptor.getValue();
        assertThat(config.llm()).isNotNull();
        assertThat(config.llm().model()).isEqualTo("gemma3:27b");
        assertThat(config.llm().llmQuery()).isEqualTo("Какая форма?");
        assertThat(config.useFullScan()).isTrue();
    }

    @Test
    void searchDocumentsWithBlankQueryReturnsError() {
        String output = mcpToolService.searchDocuments(
                "app-1", "  ", null, null, null, null, null, null, null, null);

        assertThat(output).startsWith("Error:");
        verifyNoInteractions(searchTaskService);
    }

    @Test
    void searchDocumentsWithInvalidLimitReturnsValidationMessage() {
        String output = mcpToolService.searchDocuments(
                "app-1", "устав", 0, null, null, null, null, null, null, null);

        assertThat(output).startsWith("Error:").contains("searchLimit");
        verify(searchTaskService, never()).submitSearch(anyString(), anyString(), any());
    }

    @Test
    void searchDocumentsReportsSaturatedPool() {
        given(searchTaskService.submitSearch(anyString(), anyString(), any()))
                .willThrow(new TaskSubmissionRejectedException("Too many tasks in progress, please try again later", null));

        String output = mcpToolService.searchDocuments(
                "app-1", "устав", null, null, null, null, null, null, null, null);

        assertThat(output).startsWith("Error").contains("Too many tasks");
    }

    @Test
    void searchDocumentsHidesUnexpectedFailureDetail() {
        given(searchTaskService.submitSearch(anyString(), anyString(), any()))
                .willThrow(new IllegalStateException("Connection to db-internal:5432 refused"));

        String output = mcpToolService.searchDocuments(
                "app-1", "устав", null, null, null, null, null, null, null, null);

        assertThat(output).startsWith("Error submitting search:").doesNotContain("db-internal");
    }

    // --- analyze_application ---

    @Test
    void analyzeApplicationReturnsTaskId() {
        given(searchTaskService.submitAnalysis("app-1", 3L)).willReturn("t-9");

        String output = mcpToolService.analyzeApplication("app-1", 3L);

        assertThat(output).contains("t-9");
    }

    @Test
    void analyzeApplicationWithUnknownChecklistReturnsError() {
        given(searchTaskService.submitAnalysis("app-1", 99L))
                .willThrow(new SearchValidationException("Checklist not found: 99"));

        String output = mcpToolService.analyzeApplication("app-1", 99L);

        assertThat(output).isEqualTo("Error: Checklist not found: 99");
    }

    @Test
    void analyzeApplicationWithoutChecklistReturnsError() {
        String output = mcpToolService.analyzeApplication("app-1", null);

        assertThat(output).startsWith("Error:");
        verifyNoInteractions(searchTaskService);
    }

    // --- task_status ---

    @Test
    void taskStatusShowsStageAndProgress() {
        given(searchTaskService.getStatus("t-1"))
                .willReturn(status(TaskStatus.PROGRESS, TaskStage.VECTOR_SEARCH, 30, null));

        String output = mcpToolService.taskStatus("t-1");

        assertThat(output).contains("Status: progress");
        assertThat(output).contains("Stage: vector_search (30%)");
        assertThat(output).doesNotContain("Result:");
    }

    @Test
    void taskStatusIncludesResultOnceFinished() {
        given(searchTaskService.getStatus("t-1"))
                .willReturn(status(TaskStatus.SUCCESS, TaskStage.COMPLETE, 100, Map.of("count", 3)));

        String output = mcpToolService.taskStatus("t-1");

        assertThat(output).contains("Status: success");
        assertThat(output).contains("Result:").contains("\"count\" : 3");
    }

    @Test
    void taskStatusForUnknownTaskReturnsError() {
        given(searchTaskService.getStatus("gone")).willThrow(new TaskNotFoundException("gone"));

        String output = mcpToolService.taskStatus("gone");

        assertThat(output).isEqualTo("Error: Task gone not found or expired.");
    }

    @Test
    void taskStatusHidesUnexpectedFailureDetail() {
        given(searchTaskService.getStatus("t-1"))
                .willThrow(new IllegalStateException("NPE at dev.ppee.task.TaskRegistry.get"));

        String output = mcpToolService.taskStatus("t-1");

        assertThat(output).startsWith("Error checking task status:").doesNotContain("TaskRegistry");
    }

    // --- cancel_task ---

    @Test
    void cancelTaskReportsAcknowledgement() {
        given(searchTaskService.cancel("t-1")).willReturn(new CancelAcknowledgement(
                "t-1", TaskStatus.PROGRESS, true, "Cancellation requested"));

        String output = mcpToolService.cancelTask("t-1");

        assertThat(output).isEqualTo("Task t-1 (progress): Cancellation requested");
    }

    @Test
    void cancelTaskForUnknownTaskReturnsError() {
        given(searchTaskService.cancel("gone")).willThrow(new TaskNotFoundException("gone"));

        assertThat(mcpToolService.cancelTask("gone")).startsWith("Error:");
    }

    // --- list_llm_models ---

    @Test
    void listLlmModelsFormatsOnePerLine() {
        given(searchTaskService.listModels()).willReturn(List.of("gemma3:27b", "qwen2.5:14b"));

        String output = mcpToolService.listLlmModels();

        assertThat(output).contains("- gemma3:27b").contains("- qwen2.5:14b");
    }

    @Test
    void listLlmModelsWithNoModelsReturnsHint() {
        given(searchTaskService.listModels()).willReturn(List.of());

        assertThat(mcpToolService.listLlmModels()).contains("No LLM models available");
    }

    @Test
    void listLlmModelsReportsUserMessageOfPipelineFailure() {
        given(searchTaskService.listModels())
                .willThrow(new LlmUnavailableException("GET http://ollama-gpu-01:11434/api/tags timed out"));

        String output = mcpToolService.listLlmModels();

        assertThat(output)
                .isEqualTo("Error listing models: The language model is unavailable, please try again later")
                .doesNotContain("ollama-gpu-01");
    }
}
