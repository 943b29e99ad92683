package dev.ppee.llm;

import org.jspecify.annotations.Nullable;

/**
 * Model details reported by the inference server.
 *
 * @param name model name
 * @param family model family, e.g. {@code gemma3}
 * @param parameterSize parameter count label, e.g. {@code 27.4B}
 * @param quantizationLevel quantisation label, e.g. {@code Q4_K_M}
 * @param contextLength maximum context in tokens, if reported
 */
public record ModelInfo(
    String name,
    @Nullable String family,
    @Nullable String parameterSize,
    @Nullable String quantizationLevel,
    @Nullable Integer contextLength) {}
