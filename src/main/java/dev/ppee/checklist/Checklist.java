package dev.ppee.checklist;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * A named set of questions asked of every application it is applied to.
 *
 * <p>Checklists are maintained by the administration side of the system; the analysis pipeline
 * only reads them. Maps to the {@code checklists} table managed by Flyway migrations.
 *
 * @see ChecklistParameter
 */
@Entity
@Table(name = "checklists")
public class Checklist {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false)
  private String name;

  @Column(columnDefinition = "TEXT")
  private String description;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Checklist() {
    // JPA requires no-arg constructor
  }

  public Checklist(String name, String description) {
    this.name = name;
    this.description = description;
  }

  @PrePersist
  protected void onCreate() {
    this.createdAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
