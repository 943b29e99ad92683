package dev.ppee.task;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordered pipeline stages. Declaration order is the only legal transition order: a task may skip
 * stages but never move back to an earlier one.
 *
 * <p>Each stage carries the progress checkpoint written when a task enters it.
 */
public enum TaskStage {
  STARTING("starting", 5),
  INITIALIZING("initializing", 10),
  VECTOR_SEARCH("vector_search", 30),
  HYBRID_SEARCH("hybrid_search", 30),
  RERANKING("reranking", 50),
  LLM_PROCESSING("llm_processing", 70),
  ANALYZING("analyzing", 15),
  FINISHING("finishing", 90),
  COMPLETE("complete", 100),
  FAILED("error", 100),
  CANCELLED("cancelled", 100);

  private final String value;
  private final int checkpoint;

  TaskStage(String value, int checkpoint) {
    this.value = value;
    this.checkpoint = checkpoint;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public int checkpoint() {
    return checkpoint;
  }

  /**
   * Returns whether moving from this stage to {@code next} respects the stage order. Re-entering
   * the same stage is allowed so that long stages can publish intermediate progress.
   */
  public boolean canAdvanceTo(TaskStage next) {
    return next.ordinal() >= ordinal();
  }
}
