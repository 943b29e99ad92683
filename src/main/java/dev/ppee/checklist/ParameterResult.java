package dev.ppee.checklist;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * The answer found for one checklist parameter in one application.
 *
 * <p>There is at most one row per (application, parameter); re-running an analysis overwrites it
 * via {@link #update}. {@code searchResults} and {@code llmRequest} are JSON documents kept for
 * auditing how the value was obtained.
 *
 * <p>Maps to the {@code parameter_results} table managed by Flyway migrations.
 */
@Entity
@Table(name = "parameter_results")
public class ParameterResult {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "application_id", nullable = false)
  private String applicationId;

  @Column(name = "parameter_id", nullable = false)
  private Long parameterId;

  @Column(columnDefinition = "TEXT")
  private String value;

  @Column(nullable = false)
  private double confidence;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "search_results", columnDefinition = "JSONB")
  private String searchResults;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "llm_request", columnDefinition = "JSONB")
  private String llmRequest;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ParameterResult() {
    // JPA requires no-arg constructor
  }

  public ParameterResult(String applicationId, Long parameterId) {
    this.applicationId = applicationId;
    this.parameterId = parameterId;
  }

  @PrePersist
  protected void onCreate() {
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  @PreUpdate
  protected void onUpdate() {
    this.updatedAt = Instant.now();
  }

  /** Replaces the stored answer. */
  public void update(String value, double confidence, String searchResults, String llmRequest) {
    this.value = value;
    this.confidence = confidence;
    this.searchResults = searchResults;
    this.llmRequest = llmRequest;
  }

  public Long getId() {
    return id;
  }

  public String getApplicationId() {
    return applicationId;
  }

  public Long getParameterId() {
    return parameterId;
  }

  public String getValue() {
    return value;
  }

  public double getConfidence() {
    return confidence;
  }

  public String getSearchResults() {
    return searchResults;
  }

  public String getLlmRequest() {
    return llmRequest;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
