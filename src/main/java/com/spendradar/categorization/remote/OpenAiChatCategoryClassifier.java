package com.spendradar.categorization.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spendradar.categorization.config.CategorizationSettings;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chat-completions client (POST {baseUrl}/chat/completions) constrained to answer with one category label.
 * Guarded by a local rate limiter; the call blocks for at most the configured timeout.
 */
@Slf4j
public class OpenAiChatCategoryClassifier implements RemoteCategoryClassifier {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WebClient webClient;
    private final CategorizationSettings.Remote settings;
    private final RateLimiter rateLimiter;

    public OpenAiChatCategoryClassifier(WebClient.Builder builder, CategorizationSettings.Remote settings,
                                        RateLimiter rateLimiter) {
        this.webClient = builder.baseUrl(settings.baseUrl()).build();
        this.settings = settings;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public String classify(String context, List<String> categories, String apiKey) {
        if (!rateLimiter.acquirePermission()) {
            throw new RemoteClassifierException("Local limiter refused remote classification call");
        }
        Map<String, Object> body = Map.of(
                "model", settings.model(),
                "messages", List.of(Map.of("role", "user", "content", buildPrompt(context, categories))),
                "max_tokens", settings.maxTokens(),
                "temperature", settings.temperature()
        );
        String response;
        try {
            response = webClient.post()
                    .uri("/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(settings.timeout());
        } catch (WebClientResponseException e) {
            throw new RemoteClassifierException("HTTP " + e.getStatusCode().value() + " from classifier: "
                    + e.getStatusText(), e);
        } catch (RuntimeException e) {
            throw new RemoteClassifierException("Classifier call failed: " + e.getMessage(), e);
        }
        return parseAnswer(response)
                .orElseThrow(() -> new RemoteClassifierException("Classifier response has no message content"));
    }

    /**
     * Prompt asking for exactly one label from the list, returned verbatim (non-Latin labels included).
     */
    static String buildPrompt(String context, List<String> categories) {
        return """
                You are a financial transaction categorization expert.

                %s

                Available categories: %s

                Instructions:
                1. Analyze the transaction description carefully
                2. Consider the merchant name, transaction type, and any provided context
                3. Return EXACTLY ONE category name from the list above
                4. If categories are in Hebrew, return the Hebrew name exactly as shown
                5. Return ONLY the category name, nothing else

                Category:""".formatted(context, String.join(", ", categories));
    }

    /**
     * Extracts choices[0].message.content, stripped. Empty when missing or unparseable.
     */
    static Optional<String> parseAnswer(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode content = MAPPER.readTree(json).path("choices").path(0).path("message").path("content");
            if (content.isMissingNode() || !content.isTextual()) {
                return Optional.empty();
            }
            return Optional.of(content.asText().strip());
        } catch (Exception e) {
            log.debug("Unparseable classifier response: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
