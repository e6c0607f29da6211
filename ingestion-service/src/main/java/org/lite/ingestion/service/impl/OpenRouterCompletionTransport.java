package org.lite.ingestion.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.lite.ingestion.config.IngestionProperties;
import org.lite.ingestion.exception.CompletionServiceException;
import org.lite.ingestion.exception.SummarizationException;
import org.lite.ingestion.model.CompletionRequest;
import org.lite.ingestion.service.CompletionTransport;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class OpenRouterCompletionTransport implements CompletionTransport {

    private final WebClient webClient;
    private final IngestionProperties.Completion settings;

    public OpenRouterCompletionTransport(WebClient.Builder webClientBuilder, IngestionProperties properties) {
        this.settings = properties.getCompletion();
        this.webClient = webClientBuilder.build();
    }

    @Override
    public Mono<String> send(CompletionRequest request) {
        Map<String, Object> payload = buildPayload(request);
        log.info("🌐 Sending completion request [{}] to {}", request.getLabel(), settings.getUrl());

        return webClient.post()
                .uri(settings.getUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .headers(headers -> {
                    if (settings.getApiKey() != null && !settings.getApiKey().isBlank()) {
                        headers.setBearerAuth(settings.getApiKey());
                    }
                    headers.add("HTTP-Referer", settings.getReferer());
                    headers.add("X-Title", settings.getTitle());
                })
                .bodyValue(payload)
                .retrieve()
                .onStatus(status -> status.isError(), response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(body -> {
                            log.error("❌ Completion service answered {} for [{}]: {}", response.statusCode(), request.getLabel(), body);
                            return Mono.error(new CompletionServiceException(response.statusCode().value(), body));
                        }))
                .bodyToMono(JsonNode.class)
                .timeout(settings.getRequestTimeout())
                .flatMap(response -> extractContent(response, request));
    }

    Map<String, Object> buildPayload(CompletionRequest request) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", settings.getModel());
        payload.put("messages", List.of(
                Map.of("role", "system", "content", request.getSystemPrompt()),
                Map.of("role", "user", "content", request.getUserPrompt())));
        payload.put("max_tokens", request.getMaxTokens() != null ? request.getMaxTokens() : settings.getMaxTokens());
        payload.put("temperature", settings.getTemperature());
        payload.put("transforms", List.of("middle-out"));
        if (request.isJsonResponse()) {
            payload.put("response_format", Map.of("type", "json_object"));
        }
        return payload;
    }

    private Mono<String> extractContent(JsonNode response, CompletionRequest request) {
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull() || content.asText().isBlank()) {
            return Mono.error(new SummarizationException("Completion response for [" + request.getLabel() + "] has no content"));
        }
        log.info("✅ Received completion for [{}] ({} chars)", request.getLabel(), content.asText().length());
        return Mono.just(content.asText());
    }
}
