package dev.ppee.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.ppee.checklist.Checklist;
import dev.ppee.checklist.ChecklistParameter;
import dev.ppee.checklist.ChecklistParameterRepository;
import dev.ppee.checklist.ChecklistRepository;
import dev.ppee.fixture.CandidateBuilder;
import dev.ppee.fixture.MutableClock;
import dev.ppee.llm.LlmClient;
import dev.ppee.llm.ModelInfo;
import dev.ppee.search.RetrievalStrategySelector;
import dev.ppee.search.SearchConfiguration;
import dev.ppee.search.SearchConfigurationFactory;
import dev.ppee.search.SearchMethod;
import dev.ppee.search.SearchProperties;
import dev.ppee.search.SearchValidationException;
import dev.ppee.task.CancelAcknowledgement;
import dev.ppee.task.TaskKind;
import dev.ppee.task.TaskNotFoundException;
import dev.ppee.task.TaskProperties;
import dev.ppee.task.TaskRegistry;
import dev.ppee.task.TaskStage;
import dev.ppee.task.TaskStatus;
import dev.ppee.task.TaskStatusPayload;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.test.util.ReflectionTestUtils;

class SearchTaskServiceTest {

    private final SearchConfigurationFactory factory =
            new SearchConfigurationFactory(new SearchProperties());

    private TaskRegistry registry;
    private SearchPipeline searchPipeline;
    private AnalysisPipeline analysisPipeline;
    private ChecklistRepository checklistRepository;
    private ChecklistParameterRepository parameterRepository;
    private LlmClient llmClient;

    @BeforeEach
    void setUp() {
        registry = new TaskRegistry(
                new MutableClock(Instant.parse("2026-03-01T10:00:00Z")), new TaskProperties());
        searchPipeline = mock(SearchPipeline.class);
        analysisPipeline = mock(AnalysisPipeline.class);
        checklistRepository = mock(ChecklistRepository.class);
        parameterRepository = mock(ChecklistParameterRepository.class);
        llmClient = mock(LlmClient.class);
    }

    private SearchTaskService service(TaskExecutor executor) {
        return new SearchTaskService(
                registry,
                new TaskRunner(registry),
                executor,
                new RetrievalStrategySelector(),
                searchPipeline,
                analysisPipeline,
                checklistRepository,
                parameterRepository,
                llmClient,
                "bge-m3");
    }

    private SearchConfiguration defaults() {
        return factory.create(null, null, null, null, null, null, null, null, null);
    }

    @Test
    void submitSearchRunsTaskToCompletion() {
        SearchRun run = new SearchRun(
                "устав",
                SearchMethod.HYBRID,
                List.of(CandidateBuilder.vector("c1", 0.8)),
                false,
                false,
                List.of(),
                null,
                5);
        when(searchPipeline.execute(eq("app-1"), eq("устав"), any(), any())).thenReturn(run);

        SearchTaskService service = service(new SyncTaskExecutor());
        String taskId = service.submitSearch("app-1", "устав", defaults());

        TaskStatusPayload status = service.getStatus(taskId);
        assertThat(status.kind()).isEqualTo(TaskKind.SEARCH);
        assertThat(status.status()).isEqualTo(TaskStatus.SUCCESS);
        assertThat(status.stages())
                .contains(TaskStage.HYBRID_SEARCH)
                .doesNotContain(TaskStage.VECTOR_SEARCH, TaskStage.RERANKING, TaskStage.LLM_PROCESSING);
        assertThat(status.result()).isInstanceOf(SearchOutcome.class);
        SearchOutcome outcome = (SearchOutcome) status.result();
        assertThat(outcome.applicationId()).isEqualTo("app-1");
        assertThat(outcome.count()).isEqualTo(1);
        assertThat(outcome.llm()).isNull();
    }

    @Test
    void invalidWeightIsRejectedBeforeAnyTaskExists() {
        // the request is rejected while building the configuration
        assertThatThrownBy(() -> service(new SyncTaskExecutor()).submitSearch(
                        "app-1", "устав",
                        factory.create(null, null, null, true, 1.5, null, null, null, null)))
                .isInstanceOf(SearchValidationException.class);

        assertThat(registry.size()).isZero();
        verifyNoInteractions(searchPipeline);
    }

    @Test
    void blankQueryOrApplicationIsRejected() {
        SearchTaskService service = service(new SyncTaskExecutor());

        assertThatThrownBy(() -> service.submitSearch("app-1", "   ", defaults()))
                .isInstanceOf(SearchValidationException.class);
        assertThatThrownBy(() -> service.submitSearch(" ", "устав", defaults()))
                .isInstanceOf(SearchValidationException.class);
        assertThat(registry.size()).isZero();
    }

    @Test
    void rejectedSubmissionLeavesNoTaskBehind() {
        TaskExecutor saturated = task -> {
            throw new TaskRejectedException("queue full");
        };

        assertThatThrownBy(() -> service(saturated).submitSearch("app-1", "устав", defaults()))
                .isInstanceOf(TaskSubmissionRejectedException.class)
                .hasMessageContaining("try again later");
        assertThat(registry.size()).isZero();
    }

    @Test
    void submitAnalysisRequiresKnownChecklistWithParameters() {
        SearchTaskService service = service(new SyncTaskExecutor());
        when(checklistRepository.findById(1L)).thenReturn(Optional.empty());
        Checklist empty = new Checklist("Пустой", null);
        ReflectionTestUtils.setField(empty, "id", 2L);
        when(checklistRepository.findById(2L)).thenReturn(Optional.of(empty));
        when(parameterRepository.findByChecklistIdOrderByOrderIndexAscIdAsc(2L))
                .thenReturn(List.of());

        assertThatThrownBy(() -> service.submitAnalysis("app-1", null))
                .isInstanceOf(SearchValidationException.class);
        assertThatThrownBy(() -> service.submitAnalysis("app-1", 1L))
                .isInstanceOf(SearchValidationException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> service.submitAnalysis("app-1", 2L))
                .isInstanceOf(SearchValidationException.class)
                .hasMessageContaining("no parameters");
        assertThat(registry.size()).isZero();
    }

    @Test
    void submitAnalysisSchedulesAnalysisTask() {
        Checklist checklist = new Checklist("ПД", null);
        ReflectionTestUtils.setField(checklist, "id", 3L);
        ChecklistParameter parameter = new ChecklistParameter(3L, "Форма", "форма", 0);
        when(checklistRepository.findById(3L)).thenReturn(Optional.of(checklist));
        when(parameterRepository.findByChecklistIdOrderByOrderIndexAscIdAsc(3L))
                .thenReturn(List.of(parameter));
        AnalysisOutcome outcome = new AnalysisOutcome("app-1", 3L, 1, 0, 1, List.of());
        when(analysisPipeline.execute(eq("app-1"), eq(checklist), anyList(), any()))
                .thenReturn(outcome);

        SearchTaskService service = service(new SyncTaskExecutor());
        String taskId = service.submitAnalysis("app-1", 3L);

        TaskStatusPayload status = service.getStatus(taskId);
        assertThat(status.kind()).isEqualTo(TaskKind.ANALYSIS);
        assertThat(status.status()).isEqualTo(TaskStatus.SUCCESS);
        assertThat(status.result()).isEqualTo(outcome);
    }

    @Test
    void unknownTaskIsReportedAsNotFound() {
        SearchTaskService service = service(new SyncTaskExecutor());

        assertThatThrownBy(() -> service.getStatus("missing"))
                .isInstanceOf(TaskNotFoundException.class);
        assertThatThrownBy(() -> service.cancel("missing"))
                .isInstanceOf(TaskNotFoundException.class);
    }

    @Test
    void cancelIsIdempotent() {
        SearchTaskService service = service(task -> { });
        String taskId = service.submitSearch("app-1", "устав", defaults());

        CancelAcknowledgement first = service.cancel(taskId);
        CancelAcknowledgement second = service.cancel(taskId);

        assertThat(first.cancelRequested()).isTrue();
        assertThat(second).isEqualTo(first);
        assertThat(service.getStatus(taskId).cancelRequested()).isTrue();
    }

    @Test
    void listModelsHidesEmbeddingModel() {
        when(llmClient.listModels())
                .thenReturn(List.of("gemma3:27b", "bge-m3:latest", "BGE-M3", "qwen2.5:14b"));

        assertThat(service(new SyncTaskExecutor()).listModels())
                .containsExactly("gemma3:27b", "qwen2.5:14b");
    }

    @Test
    void modelInfoRequiresName() {
        ModelInfo info = new ModelInfo("gemma3:27b", "gemma3", "27.4B", "Q4_K_M", 8192);
        when(llmClient.modelInfo("gemma3:27b")).thenReturn(Optional.of(info));
        SearchTaskService service = service(new SyncTaskExecutor());

        assertThat(service.modelInfo("gemma3:27b")).contains(info);
        assertThatThrownBy(() -> service.modelInfo(""))
                .isInstanceOf(SearchValidationException.class);
    }
}
