package eu.virtualparadox.knowledge.ingest.concept;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.knowledge.ingest.error.EFailureReason;
import eu.virtualparadox.knowledge.ingest.error.PermanentIngestionException;
import eu.virtualparadox.knowledge.ingest.error.TransientIngestionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Concept model client for any endpoint speaking the OpenAI chat-completions protocol.
 * <p>
 * The model is asked for a JSON object with {@code concepts} and {@code relationships}.
 * An empty or unparseable answer counts as "no concepts", not as a failure.
 * </p>
 */
@Slf4j
public class OpenAiCompatibleConceptModelClient implements ConceptModelClient {

    private static final String COMPLETIONS_PATH = "/chat/completions";
    private static final int MAX_ERROR_SNIPPET = 512;

    static final String SYSTEM_PROMPT = """
            You extract knowledge from educational text.
            Return a JSON object with exactly two fields:
            - "concepts": array of strings, at most 6 textbook-index-level terms (no generic single words)
            - "relationships": array, at most 3, of objects
              {"source_concept": "X", "relation_type": "is_a", "target_concept": "Y", "confidence": 0.9}
            Valid relation_type values, in priority order: is_a, part_of, prerequisite_for, used_in, opposite_of, related_to.
            Only extract relationships that are explicitly stated, with confidence >= 0.8.
            Do not use related_to just because two concepts co-occur.
            """;

    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public OpenAiCompatibleConceptModelClient(final String baseUrl,
                                              final String model,
                                              final String apiKey,
                                              final Duration timeout,
                                              final RestTemplateBuilder restTemplateBuilder,
                                              final ObjectMapper objectMapper) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Concept model base URL must be configured");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.apiKey = apiKey;
        this.objectMapper = objectMapper;
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(timeout)
                .build();
    }

    @Override
    public ConceptModelResult extract(final String text) {
        final HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }

        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("temperature", 0.0);
        body.put("response_format", Map.of("type", "json_object"));
        body.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", text)
        ));

        final JsonNode response;
        try {
            response = restTemplate.postForObject(baseUrl + COMPLETIONS_PATH, new HttpEntity<>(body, headers), JsonNode.class);
        } catch (final RestClientResponseException e) {
            throw classify(e);
        } catch (final RestClientException e) {
            throw new TransientIngestionException(EFailureReason.PROCESSING_FAILED,
                    "Concept model unreachable at " + baseUrl + ": " + e.getMessage(), e);
        }

        return parse(response);
    }

    /**
     * 429 and 5xx are worth retrying, any other client error means the input is rejected.
     */
    static RuntimeException classify(final RestClientResponseException e) {
        final int status = e.getStatusCode().value();
        final String message = "Concept model returned HTTP " + status + ": " + snippet(e.getResponseBodyAsString());
        if (status == 429 || status >= 500) {
            return new TransientIngestionException(EFailureReason.PROCESSING_FAILED, message, e);
        }
        return new PermanentIngestionException(EFailureReason.PROCESSING_FAILED, message, e);
    }

    ConceptModelResult parse(final JsonNode response) {
        if (response == null) {
            log.warn("Empty response from concept model");
            return ConceptModelResult.empty();
        }
        final JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            log.warn("Concept model response carries no message content");
            return ConceptModelResult.empty();
        }
        return parseContent(content.asText());
    }

    ConceptModelResult parseContent(final String rawContent) {
        String content = rawContent.strip();
        // some models wrap JSON in a markdown code fence
        if (content.startsWith("```")) {
            final int firstLineEnd = content.indexOf('\n');
            final int closingFence = content.lastIndexOf("```");
            if (firstLineEnd > 0 && closingFence > firstLineEnd) {
                content = content.substring(firstLineEnd + 1, closingFence).strip();
            }
        }
        try {
            final ConceptModelResult result = objectMapper.readValue(content, ConceptModelResult.class);
            return result == null ? ConceptModelResult.empty() : result;
        } catch (final JsonProcessingException e) {
            log.warn("Unparseable concept model output, treating as no concepts: {}", snippet(content));
            return ConceptModelResult.empty();
        }
    }

    private static String snippet(final String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= MAX_ERROR_SNIPPET ? s : s.substring(0, MAX_ERROR_SNIPPET) + "...";
    }
}
