package com.quarry.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quarry.config.QuarryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Abstract base class for search backends with retry and error mapping.
 */
@Slf4j
public abstract class AbstractSearchBackend implements SearchBackend {

    protected final WebClient webClient;
    protected final QuarryProperties properties;
    protected final ObjectMapper objectMapper;

    protected AbstractSearchBackend(WebClient webClient, QuarryProperties properties, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Execute request with retry logic and map failures to {@link SearchBackendException}.
     */
    protected <T> Mono<T> execute(String operation, Mono<T> request) {
        return request
                .onErrorMap(error -> !(error instanceof SearchBackendException), this::toBackendException)
                .retryWhen(Retry.backoff(properties.getBackend().getMaxRetries(), Duration.ofMillis(500))
                        .maxBackoff(Duration.ofSeconds(5))
                        .filter(this::isRetryable)
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .doOnSuccess(response -> log.debug("{} succeeded on backend {}", operation, getName()))
                .doOnError(error -> log.warn("{} failed on backend {}: {}", operation, getName(), error.getMessage()));
    }

    /**
     * Server-side and connection failures are retryable; client errors are not.
     */
    protected boolean isRetryable(Throwable throwable) {
        if (throwable instanceof SearchBackendException backendException) {
            int status = backendException.getStatus();
            return status == 0 || status == 502 || status == 503 || status == 504;
        }
        return false;
    }

    protected SearchBackendException toBackendException(Throwable error) {
        if (error instanceof WebClientResponseException responseException) {
            Integer code = null;
            String message = null;
            String detail = null;

            JsonNode body = parseBody(responseException.getResponseBodyAsString());
            if (body != null && body.isObject()) {
                if (body.hasNonNull("code") && body.get("code").canConvertToInt()) {
                    code = body.get("code").asInt();
                }
                message = textOrNull(body, "message");
                detail = textOrNull(body, "error_detail");
            }

            return new SearchBackendException(
                    responseException.getStatusCode().value(),
                    responseException.getStatusText(),
                    code,
                    message,
                    detail,
                    responseException);
        }
        return SearchBackendException.transport(error);
    }

    private JsonNode parseBody(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (Exception e) {
            log.debug("Backend error body is not JSON: {}", body);
            return null;
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }
}
