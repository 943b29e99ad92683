package dev.ppee.llm;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link LlmClient} backed by an Ollama server.
 *
 * <p>Transient {@link RestClientException}s (connection refused, read timeout, 5xx) are retried
 * with exponential backoff. 4xx responses are not retried. Once retries are exhausted
 * {@link #generate} fails with {@link LlmUnavailableException}, while the catalogue calls
 * degrade to an empty answer.
 */
@Service
public class OllamaClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaClient.class);

    private static final String CONTEXT_LENGTH_SUFFIX = ".context_length";

    private final RestClient restClient;

    public OllamaClient(@Qualifier("ollamaRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    @Retryable(
            retryFor = RestClientException.class,
            noRetryFor = HttpClientErrorException.class,
            notRecoverable = LlmUnavailableException.class,
            maxAttemptsExpression = "${ppee.ollama.retry.max-attempts}",
            backoff = @Backoff(
                    delayExpression = "${ppee.ollama.retry.delay-ms}",
                    multiplierExpression = "${ppee.ollama.retry.multiplier}"
            )
    )
    public String generate(String model, String prompt, double temperature, int maxTokens) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("temperature", temperature);
        options.put("num_predict", maxTokens);

        log.debug("Generating with model {} ({} prompt chars)", model, prompt.length());
        OllamaGenerateResponse response = restClient.post()
                .uri("/api/generate")
                .body(new OllamaGenerateRequest(model, prompt, false, options))
                .retrieve()
                .body(OllamaGenerateResponse.class);

        if (response == null) {
            throw new LlmUnavailableException("Ollama returned an empty body for model " + model);
        }
        if (response.error() != null) {
            throw new LlmUnavailableException(
                    "Ollama rejected generation for model " + model + ": " + response.error());
        }
        return response.response() == null ? "" : response.response();
    }

    @Recover
    String recoverGenerate(RestClientException e, String model, String prompt,
                           double temperature, int maxTokens) {
        log.warn("Ollama generation failed after retries for model {}: {}", model, e.getMessage());
        throw new LlmUnavailableException("Ollama generation failed for model " + model, e);
    }

    @Override
    @Retryable(
            retryFor = RestClientException.class,
            noRetryFor = HttpClientErrorException.class,
            maxAttemptsExpression = "${ppee.ollama.retry.max-attempts}",
            backoff = @Backoff(
                    delayExpression = "${ppee.ollama.retry.delay-ms}",
                    multiplierExpression = "${ppee.ollama.retry.multiplier}"
            )
    )
    public List<String> listModels() {
        OllamaTagsResponse response = restClient.get()
                .uri("/api/tags")
                .retrieve()
                .body(OllamaTagsResponse.class);
        if (response == null) {
            return List.of();
        }
        return response.models().stream()
                .map(OllamaTagsResponse.Model::name)
                .toList();
    }

    @Recover
    List<String> recoverListModels(RestClientException e) {
        log.warn("Listing Ollama models failed after retries: {}", e.getMessage());
        return List.of();
    }

    @Override
    @Retryable(
            retryFor = RestClientException.class,
            noRetryFor = HttpClientErrorException.class,
            maxAttemptsExpression = "${ppee.ollama.retry.max-attempts}",
            backoff = @Backoff(
                    delayExpression = "${ppee.ollama.retry.delay-ms}",
                    multiplierExpression = "${ppee.ollama.retry.multiplier}"
            )
    )
    public Optional<ModelInfo> modelInfo(String model) {
        OllamaShowResponse response = restClient.post()
                .uri("/api/show")
                .body(Map.of("model", model))
                .retrieve()
                .body(OllamaShowResponse.class);
        if (response == null) {
            return Optional.empty();
        }
        OllamaShowResponse.Details details = response.details();
        return Optional.of(new ModelInfo(
                model,
                details != null ? details.family() : null,
                details != null ? details.parameterSize() : null,
                details != null ? details.quantizationLevel() : null,
                contextLength(response.modelInfo())));
    }

    @Recover
    Optional<ModelInfo> recoverModelInfo(RestClientException e, String model) {
        log.warn("Reading Ollama model info failed for {}: {}", model, e.getMessage());
        return Optional.empty();
    }

    /** Ollama reports the context window under an architecture-specific key. */
    static @Nullable Integer contextLength(@Nullable Map<String, Object> modelInfo) {
        if (modelInfo == null) {
            return null;
        }
        for (Map.Entry<String, Object> entry : modelInfo.entrySet()) {
            if (entry.getKey().endsWith(CONTEXT_LENGTH_SUFFIX)
                    && entry.getValue() instanceof Number number) {
                return number.intValue();
            }
        }
        return null;
    }
}
