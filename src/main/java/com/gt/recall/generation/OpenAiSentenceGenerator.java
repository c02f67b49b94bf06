package com.gt.recall.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gt.recall.exception.SentenceGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Component
public class OpenAiSentenceGenerator implements SentenceGenerator {

    private static final Logger log = LoggerFactory.getLogger(OpenAiSentenceGenerator.class);

    private static final String DEFAULT_MODEL = "gpt-4o-mini";
    private static final int DEFAULT_MAX_TOKENS = 150;
    private static final double DEFAULT_TEMPERATURE = 0.7;
    private static final int DEFAULT_MAX_SENTENCE_LENGTH = 250;

    private static final String SYSTEM_PROMPT =
            "You are an educational content creator specializing in creating fill-in-the-blank exercises. " +
            "Your task is to create a single, natural-sounding sentence that uses a given term in context. " +
            "The sentence should be educational and reinforce understanding of the term.";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final Executor generationExecutor;
    private final String apiKey;
    private final String model;
    private final int maxTokens;
    private final double temperature;
    private final int maxSentenceLength;

    public OpenAiSentenceGenerator(RestClient.Builder restClientBuilder,
                                   OpenAiProps props,
                                   ObjectMapper objectMapper,
                                   @Qualifier("generationExecutor") Executor generationExecutor) {
        this.restClient = restClientBuilder
                .baseUrl(props.baseUrl())
                .build();
        this.objectMapper = objectMapper;
        this.generationExecutor = generationExecutor;

        this.apiKey = props.apiKey();
        this.model = props.model() != null && !props.model().isBlank() ? props.model() : DEFAULT_MODEL;
        this.maxTokens = props.maxTokens() != null ? props.maxTokens() : DEFAULT_MAX_TOKENS;
        this.temperature = props.temperature() != null ? props.temperature() : DEFAULT_TEMPERATURE;
        this.maxSentenceLength = props.maxSentenceLength() != null ? props.maxSentenceLength() : DEFAULT_MAX_SENTENCE_LENGTH;

        if (!isAvailable()) {
            log.warn("No OpenAI API key configured, sentence generation is unavailable");
        }
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public CompletableFuture<String> generateSentence(String term, String context) {
        if (!isAvailable()) {
            return CompletableFuture.failedFuture(
                    new SentenceGenerationException("Sentence generation is not configured, cannot build a sentence for '" + term + "'"));
        }

        return CompletableFuture.supplyAsync(() -> requestSentence(term, context), generationExecutor);
    }

    private String requestSentence(String term, String context) {
        log.debug("Requesting sentence for term: {}", term);

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/v1/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(buildPayload(term, context))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            log.error("Sentence generation request failed for term '{}'", term, ex);
            throw new SentenceGenerationException("Sentence generation request failed: " + ex.getMessage(), ex);
        }

        return truncate(extractSentence(response));
    }

    ObjectNode buildPayload(String term, String context) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", model);
        payload.put("temperature", temperature);
        payload.put("max_tokens", maxTokens);

        ArrayNode messages = payload.putArray("messages");
        messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
        messages.addObject().put("role", "user").put("content", buildUserPrompt(term, context));

        return payload;
    }

    static String extractSentence(JsonNode response) {
        if (response == null) {
            throw new SentenceGenerationException("Sentence generation response is empty");
        }

        JsonNode choices = response.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new SentenceGenerationException("Sentence generation response has no choices");
        }

        String content = choices.get(0).path("message").path("content").asText("").strip();
        if (content.isEmpty()) {
            throw new SentenceGenerationException("Sentence generation returned blank content");
        }

        return content;
    }

    String truncate(String sentence) {
        if (sentence.length() > maxSentenceLength) {
            return sentence.substring(0, maxSentenceLength) + "...";
        }

        return sentence;
    }

    private static String buildUserPrompt(String term, String context) {
        return "Create a fill-in-the-blank sentence for the term: " + term + "\n" +
                "Using context from this definition: " + context + "\n\n" +
                "Rules:\n" +
                "1. Create EXACTLY ONE sentence that naturally uses the term '" + term + "'\n" +
                "2. The sentence should be clear, educational, and contextually appropriate\n" +
                "3. Do NOT include any explanation, introduction, or additional text\n" +
                "4. Do NOT use bullet points or formatting\n" +
                "5. Do NOT use quotation marks around the sentence\n" +
                "6. Do NOT replace the term with blanks yourself\n" +
                "7. The sentence should be easy to understand for language learners\n" +
                "8. Response should be ONLY the single sentence, nothing more";
    }
}
