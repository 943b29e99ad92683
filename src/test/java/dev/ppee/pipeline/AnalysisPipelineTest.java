package dev.ppee.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.ppee.checklist.Checklist;
import dev.ppee.checklist.ChecklistParameter;
import dev.ppee.checklist.ParameterResult;
import dev.ppee.checklist.ParameterResultRepository;
import dev.ppee.extraction.ExtractionResult;
import dev.ppee.fixture.CandidateBuilder;
import dev.ppee.llm.LlmUnavailableException;
import dev.ppee.search.RetrievalCandidate;
import dev.ppee.search.SearchConfiguration;
import dev.ppee.search.SearchConfigurationFactory;
import dev.ppee.search.SearchMethod;
import dev.ppee.search.SearchProperties;
import dev.ppee.task.TaskCancelledException;
import dev.ppee.task.TaskStage;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class AnalysisPipelineTest {

  private static final String APP = "app-42";

  @Mock SearchPipeline searchPipeline;
  @Mock ParameterResultRepository resultRepository;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private AnalysisPipeline pipeline;
  private RecordingStageReporter reporter;
  private Checklist checklist;

  @BeforeEach
  void setUp() {
    pipeline =
        new AnalysisPipeline(
            searchPipeline,
            new SearchConfigurationFactory(new SearchProperties()),
            resultRepository,
            objectMapper);
    reporter = new RecordingStageReporter();
    checklist = new Checklist("Проверка ПД", "Основные параметры проектной документации");
    ReflectionTestUtils.setField(checklist, "id", 7L);
  }

  private static ChecklistParameter parameter(long id, String name, String query) {
    ChecklistParameter parameter = new ChecklistParameter(7L, name, query, (int) id);
    ReflectionTestUtils.setField(parameter, "id", id);
    return parameter;
  }

  private static SearchRun runWith(String value, double confidence) {
    List<RetrievalCandidate> hits =
        List.of(CandidateBuilder.vector("c1", 0.91), CandidateBuilder.vector("c2", 0.87));
    ExtractionResult extraction =
        new ExtractionResult(
            value,
            confidence,
            hits,
            SearchMethod.VECTOR,
            hits.size(),
            "Ответ: " + value,
            "result_prefix",
            "prompt text");
    return new SearchRun("q", SearchMethod.VECTOR, hits, false, false, List.of(), extraction, 12);
  }

  @Test
  void storesOneResultPerParameter() {
    ChecklistParameter form = parameter(1, "Форма", "организационно-правовая форма");
    ChecklistParameter inn = parameter(2, "ИНН", "ИНН заказчика");
    given(searchPipeline.execute(eq(APP), anyString(), any(), any()))
        .willReturn(runWith("АО", 0.9), runWith("7701234567", 0.95));
    given(resultRepository.findByApplicationIdAndParameterId(eq(APP), any()))
        .willReturn(Optional.empty());

    AnalysisOutcome outcome = pipeline.execute(APP, checklist, List.of(form, inn), reporter);

    assertThat(outcome.processed()).isEqualTo(2);
    assertThat(outcome.errors()).isZero();
    assertThat(outcome.total()).isEqualTo(2);
    assertThat(outcome.checklistId()).isEqualTo(7L);
    assertThat(outcome.parameters())
        .extracting(ParameterSummary::value)
        .containsExactly("АО", "7701234567");
    then(resultRepository).should(times(2)).save(any(ParameterResult.class));
  }

  @Test
  void progressCoversAnalysisWindowPerParameter() {
    List<ChecklistParameter> parameters =
        List.of(
            parameter(1, "a", "запрос a"),
            parameter(2, "b", "запрос b"),
            parameter(3, "c", "запрос c"),
            parameter(4, "d", "запрос d"));
    given(searchPipeline.execute(eq(APP), anyString(), any(), any()))
        .willReturn(runWith("x", 0.8));
    given(resultRepository.findByApplicationIdAndParameterId(eq(APP), any()))
        .willReturn(Optional.empty());

    pipeline.execute(APP, checklist, parameters, reporter);

    assertThat(reporter.stages)
        .containsExactly(
            TaskStage.STARTING,
            TaskStage.INITIALIZING,
            TaskStage.ANALYZING,
            TaskStage.ANALYZING,
            TaskStage.ANALYZING,
            TaskStage.ANALYZING,
            TaskStage.FINISHING);
    assertThat(reporter.progress).containsExactly(5, 10, 15, 33, 52, 71, 90);
  }

  @Test
  void existingResultIsUpdatedInPlace() throws Exception {
    ChecklistParameter form = parameter(1, "Форма", "организационно-правовая форма");
    ParameterResult existing = new ParameterResult(APP, 1L);
    existing.update("ООО", 0.5, "[]", "{}");
    given(searchPipeline.execute(eq(APP), anyString(), any(), any()))
        .willReturn(runWith("АО", 0.9));
    given(resultRepository.findByApplicationIdAndParameterId(APP, 1L))
        .willReturn(Optional.of(existing));

    pipeline.execute(APP, checklist, List.of(form), reporter);

    ArgumentCaptor<ParameterResult> saved = ArgumentCaptor.forClass(ParameterResult.class);
    then(resultRepository).should().save(saved.capture());
    assertThat(saved.getValue()).isSameAs(existing);
    assertThat(existing.getValue()).isEqualTo("АО");
    assertThat(existing.getConfidence()).isEqualTo(0.9);

    JsonNode hits = objectMapper.readTree(existing.getSearchResults());
    assertThat(hits).hasSize(2);
    assertThat(hits.get(0).get("position").asInt()).isEqualTo(1);
    JsonNode request = objectMapper.readTree(existing.getLlmRequest());
    assertThat(request.get("search_query").asText()).isEqualTo("организационно-правовая форма");
    assertThat(request.get("model").asText()).isEqualTo("gemma3:27b");
    assertThat(request.get("response_format").asText()).isEqualTo("result_prefix");
  }

  @Test
  void failingParameterIsCountedAndAnalysisContinues() {
    ChecklistParameter first = parameter(1, "Форма", "организационно-правовая форма");
    ChecklistParameter second = parameter(2, "ИНН", "ИНН заказчика");
    given(searchPipeline.execute(eq(APP), eq("организационно-правовая форма"), any(), any()))
        .willThrow(new LlmUnavailableException("connect timed out"));
    given(searchPipeline.execute(eq(APP), eq("ИНН заказчика"), any(), any()))
        .willReturn(runWith("7701234567", 0.95));
    given(resultRepository.findByApplicationIdAndParameterId(APP, 2L))
        .willReturn(Optional.empty());

    AnalysisOutcome outcome = pipeline.execute(APP, checklist, List.of(first, second), reporter);

    assertThat(outcome.processed()).isEqualTo(1);
    assertThat(outcome.errors()).isEqualTo(1);
    ParameterSummary failed = outcome.parameters().get(0);
    assertThat(failed.success()).isFalse();
    assertThat(failed.error()).doesNotContain("timed out");
    assertThat(outcome.parameters().get(1).success()).isTrue();
  }

  @Test
  void cancellationObservedAfterSearchStoresNothing() {
    ChecklistParameter form = parameter(1, "Форма", "организационно-правовая форма");
    given(searchPipeline.execute(eq(APP), anyString(), any(), any()))
        .willAnswer(
            invocation -> {
              reporter.cancelled = true;
              return runWith("АО", 0.9);
            });

    assertThatThrownBy(() -> pipeline.execute(APP, checklist, List.of(form), reporter))
        .isInstanceOf(TaskCancelledException.class);
    then(resultRepository).should(never()).save(any());
  }

  @Test
  void cancellationInsideSearchStopsRemainingParameters() {
    ChecklistParameter first = parameter(1, "a", "запрос a");
    ChecklistParameter second = parameter(2, "b", "запрос b");
    given(searchPipeline.execute(eq(APP), eq("запрос a"), any(), any()))
        .willThrow(new TaskCancelledException("task-1"));

    assertThatThrownBy(() -> pipeline.execute(APP, checklist, List.of(first, second), reporter))
        .isInstanceOf(TaskCancelledException.class);
    then(searchPipeline).should(never()).execute(eq(APP), eq("запрос b"), any(), any());
  }

  @Test
  void configurationComesFromParameterRow() {
    ChecklistParameter parameter = parameter(1, "Форма", "форма");
    parameter.setUseReranker(true);
    parameter.setRerankLimit(0);
    parameter.setSearchLimit(4);
    parameter.setUseFullScan(true);
    parameter.setLlmModel("qwen2.5:14b");
    parameter.setLlmTemperature(0.3);
    parameter.setLlmQuery("Какая организационно-правовая форма?");

    SearchConfiguration config = pipeline.configurationFor(parameter);

    assertThat(config.searchLimit()).isEqualTo(4);
    assertThat(config.useReranker()).isTrue();
    assertThat(config.rerankAll()).isTrue();
    assertThat(config.useFullScan()).isTrue();
    assertThat(config.llm()).isNotNull();
    assertThat(config.llm().model()).isEqualTo("qwen2.5:14b");
    assertThat(config.llm().temperature()).isEqualTo(0.3);
    assertThat(config.llm().maxTokens()).isEqualTo(1000);
    assertThat(config.llm().effectiveQuery("форма"))
        .isEqualTo("Какая организационно-правовая форма?");
  }

  @Test
  void missingRerankLimitUsesDefault() {
    ChecklistParameter parameter = parameter(1, "Форма", "форма");
    parameter.setUseReranker(true);

    assertThat(pipeline.configurationFor(parameter).rerankLimit()).isEqualTo(20);
  }
}
