package dev.ppee.api;

import jakarta.validation.constraints.NotNull;

/** Body of an analysis submission. */
public record AnalysisRequest(@NotNull Long checklistId) {}
