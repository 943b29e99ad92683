package dev.ppee.task;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for background task execution.
 *
 * <p>Properties are bound from {@code ppee.tasks.*} in application.yml.
 *
 * <ul>
 *   <li>{@code retention} - how long a finished task stays pollable after its last update or poll (default 1h)
 *   <li>{@code worker-pool-size} - number of concurrent pipeline workers (default 4)
 *   <li>{@code queue-capacity} - submissions waiting for a free worker (default 100)
 *   <li>{@code eviction-interval-ms} - delay between eviction sweeps (default 60000)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "ppee.tasks")
public class TaskProperties {

  private Duration retention = Duration.ofHours(1);
  private int workerPoolSize = 4;
  private int queueCapacity = 100;
  private long evictionIntervalMs = 60_000;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (retention.isNegative() || retention.isZero()) {
      throw new IllegalStateException("ppee.tasks.retention must be positive, got: " + retention);
    }
    if (workerPoolSize < 1) {
      throw new IllegalStateException(
          "ppee.tasks.worker-pool-size must be >= 1, got: " + workerPoolSize);
    }
    if (queueCapacity < 0) {
      throw new IllegalStateException(
          "ppee.tasks.queue-capacity must be >= 0, got: " + queueCapacity);
    }
    if (evictionIntervalMs < 1000) {
      throw new IllegalStateException(
          "ppee.tasks.eviction-interval-ms must be >= 1000, got: " + evictionIntervalMs);
    }
  }

  public Duration getRetention() {
    return retention;
  }

  public void setRetention(Duration retention) {
    this.retention = retention;
  }

  public int getWorkerPoolSize() {
    return workerPoolSize;
  }

  public void setWorkerPoolSize(int workerPoolSize) {
    this.workerPoolSize = workerPoolSize;
  }

  public int getQueueCapacity() {
    return queueCapacity;
  }

  public void setQueueCapacity(int queueCapacity) {
    this.queueCapacity = queueCapacity;
  }

  public long getEvictionIntervalMs() {
    return evictionIntervalMs;
  }

  public void setEvictionIntervalMs(long evictionIntervalMs) {
    this.evictionIntervalMs = evictionIntervalMs;
  }
}
