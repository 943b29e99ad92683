package dev.ppee.config;

import dev.ppee.task.TaskProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded worker pool running search and analysis tasks off the request thread.
 *
 * <p>When every worker is busy and the queue is full, submissions are rejected with {@link
 * org.springframework.core.task.TaskRejectedException}; the caller turns that into a 503.
 */
@Configuration
public class TaskExecutorConfig {

  @Bean(name = "searchTaskExecutor")
  public ThreadPoolTaskExecutor searchTaskExecutor(TaskProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.getWorkerPoolSize());
    executor.setMaxPoolSize(properties.getWorkerPoolSize());
    executor.setQueueCapacity(properties.getQueueCapacity());
    executor.setThreadNamePrefix("ppee-task-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    return executor;
  }
}
