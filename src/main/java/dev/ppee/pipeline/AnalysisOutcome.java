package dev.ppee.pipeline;

import java.util.List;

/**
 * Result payload of a successful analysis task.
 *
 * @param applicationId the analysed application
 * @param checklistId the checklist that was run
 * @param processed parameters whose result was stored
 * @param errors parameters that failed
 * @param total parameters in the checklist
 * @param parameters per-parameter summaries in checklist order
 */
public record AnalysisOutcome(
    String applicationId,
    Long checklistId,
    int processed,
    int errors,
    int total,
    List<ParameterSummary> parameters) {

  public AnalysisOutcome {
    parameters = List.copyOf(parameters);
  }
}
