package dev.ppee.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;

import dev.ppee.BaseIntegrationTest;
import dev.ppee.checklist.Checklist;
import dev.ppee.checklist.ChecklistParameter;
import dev.ppee.checklist.ChecklistParameterRepository;
import dev.ppee.checklist.ChecklistRepository;
import dev.ppee.checklist.ParameterResult;
import dev.ppee.checklist.ParameterResultRepository;
import dev.ppee.llm.LlmUnavailableException;
import dev.ppee.search.SearchConfigurationFactory;
import dev.ppee.search.SearchMethod;
import dev.ppee.task.TaskStatus;
import dev.ppee.task.TaskStatusPayload;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class SearchTaskIT extends BaseIntegrationTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(30);

  @Autowired SearchTaskService searchTaskService;
  @Autowired SearchConfigurationFactory configurationFactory;
  @Autowired ChecklistRepository checklistRepository;
  @Autowired ChecklistParameterRepository parameterRepository;
  @Autowired ParameterResultRepository resultRepository;

  @BeforeEach
  void seedTestData() {
    seedChunk(
        "app-7",
        "doc-1",
        0,
        "Организационно-правовая форма заказчика: акционерное общество.");
    seedChunk("app-7", "doc-1", 1, "Проектная мощность котельной составляет 12 МВт.");
  }

  @AfterEach
  void cleanChecklists() {
    checklistRepository.deleteAll();
  }

  private TaskStatusPayload awaitTerminal(String taskId) throws InterruptedException {
    long deadline = System.nanoTime() + TIMEOUT.toNanos();
    TaskStatusPayload status = searchTaskService.getStatus(taskId);
    while (!status.status().isTerminal() && System.nanoTime() < deadline) {
      Thread.sleep(50);
      status = searchTaskService.getStatus(taskId);
    }
    return status;
  }

  @Test
  void searchWithLlmCompletesWithExtractedAnswer() throws InterruptedException {
    given(llmClient.generate(eq("gemma3:27b"), anyString(), anyDouble(), anyInt()))
        .willReturn("Организационно-правовая форма: акционерное общество");

    String taskId =
        searchTaskService.submitSearch(
            "app-7",
            "организационно-правовая форма заказчика",
            configurationFactory.create(
                2,
                null,
                null,
                null,
                null,
                null,
                null,
                null,
                configurationFactory.llmOptions(null, null, null, null, null)));
    TaskStatusPayload status = awaitTerminal(taskId);

    assertThat(status.status()).isEqualTo(TaskStatus.SUCCESS);
    assertThat(status.progress()).isEqualTo(100);
    SearchOutcome outcome = (SearchOutcome) status.result();
    assertThat(outcome.method()).isEqualTo(SearchMethod.VECTOR);
    assertThat(outcome.results()).isNotEmpty();
    assertThat(outcome.results().get(0).text()).contains("акционерное общество");
    assertThat(outcome.llm()).isNotNull();
    assertThat(outcome.llm().value()).isEqualTo("акционерное общество");
  }

  @Test
  void unreachableLlmFailsTaskWithUserSafeMessage() throws InterruptedException {
    given(llmClient.generate(anyString(), anyString(), anyDouble(), anyInt()))
        .willThrow(new LlmUnavailableException("Connection refused: 10.0.0.5"));

    String taskId =
        searchTaskService.submitSearch(
            "app-7",
            "организационно-правовая форма заказчика",
            configurationFactory.create(
                null,
                null,
                null,
                null,
                null,
                null,
                null,
                null,
                configurationFactory.llmOptions(null, null, null, null, null)));
    TaskStatusPayload status = awaitTerminal(taskId);

    assertThat(status.status()).isEqualTo(TaskStatus.ERROR);
    assertThat(status.message()).doesNotContain("10.0.0.5");
    assertThat(status.result()).isNull();
  }

  @Test
  void analysisStoresOneResultPerParameter() throws InterruptedException {
    given(llmClient.generate(anyString(), anyString(), anyDouble(), anyInt()))
        .willReturn("Форма: акционерное общество", "Мощность: 12 МВт");
    Checklist checklist =
        checklistRepository.save(new Checklist("Экспертиза ПД", "Основные параметры"));
    parameterRepository.saveAll(
        List.of(
            new ChecklistParameter(
                checklist.getId(), "Форма", "организационно-правовая форма", 0),
            new ChecklistParameter(checklist.getId(), "Мощность", "мощность котельной", 1)));

    String taskId = searchTaskService.submitAnalysis("app-7", checklist.getId());
    TaskStatusPayload status = awaitTerminal(taskId);

    assertThat(status.status()).isEqualTo(TaskStatus.SUCCESS);
    AnalysisOutcome outcome = (AnalysisOutcome) status.result();
    assertThat(outcome.processed()).isEqualTo(2);
    assertThat(outcome.errors()).isZero();
    assertThat(resultRepository.findByApplicationId("app-7"))
        .extracting(ParameterResult::getValue)
        .containsExactlyInAnyOrder("акционерное общество", "12 МВт");
  }
}
