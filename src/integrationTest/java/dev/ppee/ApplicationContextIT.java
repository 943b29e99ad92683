package dev.ppee;

import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class ApplicationContextIT extends BaseIntegrationTest {

    @Autowired
    @Qualifier("ppeeTools")
    private ToolCallbackProvider ppeeTools;

    @Autowired
    @Qualifier("searchTaskExecutor")
    private TaskExecutor searchTaskExecutor;

    @Test
    void mcpToolsAreRegistered() {
        assertThat(Arrays.stream(ppeeTools.getToolCallbacks())
                .map(ToolCallback::getToolDefinition)
                .map(definition -> definition.name()))
                .containsExactlyInAnyOrder(
                        "search_documents", "analyze_application", "task_status",
                        "cancel_task", "list_llm_models");
    }

    @Test
    void workerPoolIsBoundedByTaskProperties() {
        assertThat(searchTaskExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor pool = (ThreadPoolTaskExecutor) searchTaskExecutor;
        assertThat(pool.getCorePoolSize()).isEqualTo(pool.getMaxPoolSize());
        assertThat(pool.getThreadNamePrefix()).isEqualTo("ppee-task-");
    }
}
