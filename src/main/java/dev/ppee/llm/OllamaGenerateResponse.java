package dev.ppee.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/** Non-streaming JSON response of the Ollama {@code /api/generate} endpoint. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OllamaGenerateResponse(
    @Nullable String model, @Nullable String response, boolean done, @Nullable String error) {}
