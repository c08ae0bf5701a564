package com.example.intel.analysis;

import com.example.intel.exception.AnalysisUnavailableException;
import com.example.intel.exception.MalformedCollaboratorOutputException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API로 브리핑 분석을 생성한다.
 */
@Component
public class AnthropicAnalysisCollaborator implements AnalysisCollaborator {

    private static final Logger log = LoggerFactory.getLogger(AnthropicAnalysisCollaborator.class);
    static final String ANTHROPIC_VERSION = "2023-06-01";

    private final WebClient http;
    private final ObjectMapper objectMapper;
    private final BriefingPromptBuilder prompts;
    private final AnalysisOutputParser parser;
    private final String apiKey;
    private final String model;
    private final int maxTokens;

    public AnthropicAnalysisCollaborator(@Qualifier("anthropicHttp") WebClient http,
                                         ObjectMapper objectMapper,
                                         BriefingPromptBuilder prompts,
                                         AnalysisOutputParser parser,
                                         @Value("${anthropic.api-key:}") String apiKey,
                                         @Value("${anthropic.model:claude-sonnet-4-20250514}") String model,
                                         @Value("${anthropic.max-tokens:8096}") int maxTokens) {
        this.http = http;
        this.objectMapper = objectMapper;
        this.prompts = prompts;
        this.parser = parser;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.model = model;
        this.maxTokens = maxTokens;
    }

    @Override
    public Mono<AnalysisOutput> analyze(AnalysisContext context) {
        if (apiKey.isBlank()) {
            return Mono.error(new AnalysisUnavailableException(
                    "ANTHROPIC_API_KEY is not configured. Set anthropic.api-key to enable briefings."));
        }
        return Mono.fromCallable(() -> requestBody(context))
                .flatMap(body -> http.post()
                        .uri("/v1/messages")
                        .header("x-api-key", apiKey)
                        .header("anthropic-version", ANTHROPIC_VERSION)
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.APPLICATION_JSON)
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(String.class))
                .map(this::extractText)
                .map(parser::parse)
                .doOnSuccess(out -> log.info("Analysis generated portfolio={} items={} alerts={}",
                        context.getPortfolioId(), out.getItems().size(), out.getRiskAlerts().size()))
                .onErrorMap(WebClientResponseException.class, e -> new AnalysisUnavailableException(
                        "Intelligence service returned HTTP " + e.getStatusCode().value(), e))
                .onErrorMap(WebClientRequestException.class, e -> new AnalysisUnavailableException(
                        "Intelligence service unreachable: " + e.getMessage(), e));
    }

    Map<String, Object> requestBody(AnalysisContext context) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("max_tokens", maxTokens);
        body.put("system", prompts.systemPrompt());
        body.put("messages", List.of(Map.of("role", "user", "content", prompts.userMessage(context))));
        return body;
    }

    String extractText(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new MalformedCollaboratorOutputException("Failed to read intelligence service envelope", e);
        }
        JsonNode first = root.path("content").path(0);
        JsonNode text = first.path("text");
        if (!text.isTextual()) {
            throw new MalformedCollaboratorOutputException("Intelligence service returned no text content", null);
        }
        return text.asText();
    }
}
