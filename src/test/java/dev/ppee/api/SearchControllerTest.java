package dev.ppee.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.ppee.config.GlobalExceptionHandler;
import dev.ppee.llm.LlmUnavailableException;
import dev.ppee.llm.ModelInfo;
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
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class SearchControllerTest {

  @Mock SearchTaskService searchTaskService;

  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    SearchController controller =
        new SearchController(
            searchTaskService, new SearchConfigurationFactory(new SearchProperties()));
    mvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void searchSubmissionAnswersAcceptedWithTaskLink() throws Exception {
    given(searchTaskService.submitSearch(eq("app-1"), eq("устав"), any())).willReturn("t-1");

    mvc.perform(
            post("/api/applications/app-1/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"query": "устав", "useReranker": true, "rerankLimit": "all",
                     "llm": {"model": "gemma3:27b", "temperature": 0.2}}
                    """))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.taskId").value("t-1"))
        .andExpect(jsonPath("$.statusUrl").value("/api/tasks/t-1"));

    ArgumentCaptor<SearchConfiguration> config =
        ArgumentCaptor.forClass(SearchConfiguration.class);
    then(searchTaskService).should().submitSearch(eq("app-1"), eq("устав"), config.capture());
    assertThat(config.getValue().rerankAll()).isTrue();
    assertThat(config.getValue().llm().temperature()).isEqualTo(0.2);
  }

  @Test
  void outOfRangeWeightIsBadRequestAndNothingIsSubmitted() throws Exception {
    mvc.perform(
            post("/api/applications/app-1/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"устав\", \"vectorWeight\": 1.5}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("vectorWeight must be in [0.0, 1.0], got: 1.5"));

    then(searchTaskService).should(never()).submitSearch(anyString(), anyString(), any());
  }

  @Test
  void blankQueryFailsBeanValidation() throws Exception {
    mvc.perform(
            post("/api/applications/app-1/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"  \"}"))
        .andExpect(status().isBadRequest());

    then(searchTaskService).shouldHaveNoInteractions();
  }

  @Test
  void unknownChecklistIsBadRequest() throws Exception {
    given(searchTaskService.submitAnalysis("app-1", 99L))
        .willThrow(new SearchValidationException("Checklist not found: 99"));

    mvc.perform(
            post("/api/applications/app-1/analysis")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"checklistId\": 99}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Checklist not found: 99"));
  }

  @Test
  void saturatedPoolIsServiceUnavailable() throws Exception {
    given(searchTaskService.submitAnalysis("app-1", 1L))
        .willThrow(
            new TaskSubmissionRejectedException(
                "Too many tasks in progress, please try again later", null));

    mvc.perform(
            post("/api/applications/app-1/analysis")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"checklistId\": 1}"))
        .andExpect(status().isServiceUnavailable());
  }

  @Test
  void taskStatusIsSerializedWithWireNames() throws Exception {
    given(searchTaskService.getStatus("t-1"))
        .willReturn(
            new TaskStatusPayload(
                "t-1",
                TaskKind.SEARCH,
                TaskStatus.PROGRESS,
                TaskStage.VECTOR_SEARCH,
                30,
                "Running vector search",
                List.of(TaskStage.STARTING, TaskStage.VECTOR_SEARCH, TaskStage.COMPLETE),
                false,
                null));

    mvc.perform(get("/api/tasks/t-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("progress"))
        .andExpect(jsonPath("$.stage").value("vector_search"))
        .andExpect(jsonPath("$.progress").value(30))
        .andExpect(jsonPath("$.stages[2]").value("complete"))
        .andExpect(jsonPath("$.result").doesNotExist());
  }

  @Test
  void unknownTaskIsNotFound() throws Exception {
    given(searchTaskService.getStatus("gone")).willThrow(new TaskNotFoundException("gone"));

    mvc.perform(get("/api/tasks/gone")).andExpect(status().isNotFound());
  }

  @Test
  void cancelReturnsAcknowledgement() throws Exception {
    given(searchTaskService.cancel("t-1"))
        .willReturn(new CancelAcknowledgement("t-1", TaskStatus.PROGRESS, true, "stopping"));

    mvc.perform(post("/api/tasks/t-1/cancel"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.cancelRequested").value(true))
        .andExpect(jsonPath("$.status").value("progress"));
  }

  @Test
  void modelsAreListed() throws Exception {
    given(searchTaskService.listModels()).willReturn(List.of("gemma3:27b"));

    mvc.perform(get("/api/llm/models"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0]").value("gemma3:27b"));
  }

  @Test
  void unknownModelIsNotFound() throws Exception {
    given(searchTaskService.modelInfo("nope")).willReturn(Optional.empty());

    mvc.perform(get("/api/llm/models/nope")).andExpect(status().isNotFound());
  }

  @Test
  void unreachableModelServerIsServiceUnavailable() throws Exception {
    given(searchTaskService.modelInfo("gemma3:27b"))
        .willThrow(new LlmUnavailableException("Connection refused"));

    mvc.perform(get("/api/llm/models/gemma3:27b"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(
            jsonPath("$.detail").value("The language model is unavailable, please try again later"));
  }

  @Test
  void modelInfoIsReturned() throws Exception {
    given(searchTaskService.modelInfo("gemma3"))
        .willReturn(Optional.of(new ModelInfo("gemma3", "gemma3", "27.4B", "Q4_K_M", 8192)));

    mvc.perform(get("/api/llm/models/gemma3"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.contextLength").value(8192));
  }
}
