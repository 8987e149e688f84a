package com.paperless.genai.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.paperless.genai.config.GeminiProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * {@link TextSummarizer} backed by the Gemini {@code generateContent} endpoint.
 * <p>
 * Server errors, 408, 429, connection failures and timeouts are retried with exponential
 * back-off (2s, 4s, 8s, ...). Once retries run out a {@link SummarizerUnavailableException}
 * is thrown. Other HTTP errors and unusable responses yield an empty result.
 */
@Slf4j
public class GeminiSummarizer implements TextSummarizer {

    private static final Duration FIRST_BACKOFF = Duration.ofSeconds(2);

    private final WebClient webClient;
    private final GeminiProperties properties;
    private final Duration firstBackoff;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GeminiSummarizer(WebClient webClient, GeminiProperties properties) {
        this(webClient, properties, FIRST_BACKOFF);
    }

    GeminiSummarizer(WebClient webClient, GeminiProperties properties, Duration firstBackoff) {
        this.webClient = webClient;
        this.properties = properties;
        this.firstBackoff = firstBackoff;
    }

    @Override
    public Optional<String> summarize(String text) {
        if (text == null || text.isBlank()) {
            log.warn("Empty text supplied to summarizer");
            return Optional.empty();
        }

        log.info("Requesting summary from Gemini ({}) for {} characters", properties.getModel(), text.length());

        String response;
        try {
            response = webClient
                    .post()
                    .uri(properties.getBaseUrl() + "/models/" + properties.getModel()
                            + ":generateContent?key=" + properties.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(buildRequestBody(buildPrompt(text)))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .retryWhen(Retry.backoff(properties.getMaxRetries(), firstBackoff)
                            .jitter(0)
                            .filter(GeminiSummarizer::isTransient)
                            .doBeforeRetry(signal -> log.warn("Gemini retry {} after: {}",
                                    signal.totalRetries() + 1, signal.failure().toString())))
                    .block();
        } catch (RuntimeException e) {
            if (Exceptions.isRetryExhausted(e)) {
                log.error("Gemini API call failed after {} retries", properties.getMaxRetries(), e.getCause());
                throw new SummarizerUnavailableException(
                        "Gemini API unavailable after " + properties.getMaxRetries() + " retries", e.getCause());
            }
            if (Exceptions.unwrap(e) instanceof WebClientResponseException responseError) {
                log.error("Gemini API responded {}: {}", responseError.getStatusCode().value(),
                        responseError.getStatusText());
                return Optional.empty();
            }
            throw e;
        }

        return extractSummary(response);
    }

    static boolean isTransient(Throwable error) {
        if (error instanceof WebClientResponseException responseError) {
            int status = responseError.getStatusCode().value();
            return status >= 500 || status == 408 || status == 429;
        }
        return error instanceof WebClientRequestException || error instanceof TimeoutException;
    }

    private static String buildPrompt(String text) {
        return """
                You are a document summarization assistant for a Document Management System (DMS).
                Analyse the following OCR-extracted text and provide a structured summary.

                Instructions:
                1. Write a concise executive summary (2-3 sentences)
                2. List 3-5 key points from the document
                3. Identify the document type if possible
                4. Extract important dates, numbers or entities mentioned
                5. Stay factual and objective, do not add interpretations

                Document text:
                ---
                %s
                ---

                Provide the summary now.
                """.formatted(text);
    }

    private static Map<String, Object> buildRequestBody(String prompt) {
        return Map.of(
                "contents", List.of(
                        Map.of("parts", List.of(
                                Map.of("text", prompt)))),
                "generationConfig", Map.of(
                        "temperature", 0.3,
                        "topK", 40,
                        "topP", 0.95,
                        "maxOutputTokens", 1024));
    }

    private Optional<String> extractSummary(String response) {
        if (response == null || response.isBlank()) {
            log.warn("Empty response body from Gemini");
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse Gemini response: {}", e.getOriginalMessage());
            return Optional.empty();
        }

        JsonNode candidates = root.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            log.warn("No candidates in Gemini response");
            return Optional.empty();
        }

        JsonNode parts = candidates.get(0).path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) {
            log.warn("No content parts in first Gemini candidate");
            return Optional.empty();
        }

        JsonNode textNode = parts.get(0).path("text");
        if (!textNode.isTextual() || textNode.asText().isBlank()) {
            log.warn("No text in first Gemini content part");
            return Optional.empty();
        }

        String summary = textNode.asText().trim();
        log.info("Gemini summary generated ({} chars)", summary.length());
        return Optional.of(summary);
    }
}
