package dev.ppee.llm;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to talk to the Ollama server.
 *
 * <p>Timeouts are externalized via {@code ppee.ollama.*} properties. Generation on large models
 * is slow, so the read timeout is measured in minutes. The client defaults to JSON content type
 * and is qualified as {@code "ollamaRestClient"}.
 */
@Configuration
public class OllamaConfig {

    /**
     * Creates a pre-configured {@link RestClient} targeting the Ollama server.
     *
     * @param builder          Spring-provided builder with common defaults
     * @param baseUrl          server base URL (e.g. {@code http://localhost:11434})
     * @param connectTimeoutMs TCP connection timeout in milliseconds
     * @param readTimeoutMs    response read timeout in milliseconds
     * @return a named REST client bean for injection into {@link OllamaClient}
     */
    @Bean
    public RestClient ollamaRestClient(
            RestClient.Builder builder,
            @Value("${ppee.ollama.base-url}") String baseUrl,
            @Value("${ppee.ollama.connect-timeout-ms}") int connectTimeoutMs,
            @Value("${ppee.ollama.read-timeout-ms}") int readTimeoutMs) {

        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(connectTimeoutMs));
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));

        return builder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
