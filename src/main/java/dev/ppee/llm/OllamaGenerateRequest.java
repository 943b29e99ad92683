package dev.ppee.llm;

import java.util.Map;

/** JSON body of the Ollama {@code /api/generate} endpoint. */
public record OllamaGenerateRequest(
    String model, String prompt, boolean stream, Map<String, Object> options) {}
