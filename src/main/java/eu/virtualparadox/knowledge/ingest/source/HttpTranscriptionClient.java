package eu.virtualparadox.knowledge.ingest.source;

import com.fasterxml.jackson.databind.JsonNode;
import eu.virtualparadox.knowledge.application.config.IngestionProperties;
import eu.virtualparadox.knowledge.ingest.error.EFailureReason;
import eu.virtualparadox.knowledge.ingest.error.PermanentIngestionException;
import eu.virtualparadox.knowledge.ingest.error.TransientIngestionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link TranscriptionClient} for a job-style HTTP transcription service.
 * <ul>
 *   <li>{@code POST {base}/jobs} with {@code {"source_ref": ...}} answers {@code {"id": ...}}</li>
 *   <li>{@code GET {base}/jobs/{id}} answers {@code {"status": ..., "text": ..., "error": ...}}; the
 *       transcript may also arrive as a {@code content} array of timed segments</li>
 * </ul>
 */
@Slf4j
@Service
public class HttpTranscriptionClient implements TranscriptionClient {

    private static final String JOBS_PATH = "/jobs";

    private final String baseUrl;
    private final String apiKey;
    private final RestTemplate restTemplate;

    public HttpTranscriptionClient(final IngestionProperties properties, final RestTemplateBuilder restTemplateBuilder) {
        final IngestionProperties.Transcription cfg = properties.getTranscription();
        final String url = cfg.getBaseUrl();
        this.baseUrl = url == null || url.isBlank() ? null : (url.endsWith("/") ? url.substring(0, url.length() - 1) : url);
        this.apiKey = cfg.getApiKey();
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(cfg.getTimeout())
                .build();
    }

    @Override
    public String submitJob(final String sourceRef) {
        if (baseUrl == null) {
            throw new PermanentIngestionException(EFailureReason.EXTERNAL_SUBMIT_FAILED,
                    "No transcription service configured (knowledge.ingestion.transcription.base-url)");
        }

        final JsonNode response;
        try {
            response = restTemplate.postForObject(baseUrl + JOBS_PATH,
                    new HttpEntity<>(Map.of("source_ref", sourceRef), headers()), JsonNode.class);
        } catch (final RestClientResponseException e) {
            throw classify(e.getStatusCode().value(), EFailureReason.EXTERNAL_SUBMIT_FAILED, "Transcription submit", e);
        } catch (final RestClientException e) {
            throw new TransientIngestionException(EFailureReason.EXTERNAL_SUBMIT_FAILED,
                    "Transcription service unreachable: " + e.getMessage(), e);
        }

        final String id = response == null ? null : firstText(response, "id", "job_id");
        if (id == null || id.isBlank()) {
            throw new PermanentIngestionException(EFailureReason.EXTERNAL_SUBMIT_FAILED,
                    "Transcription service returned no job id for " + sourceRef);
        }
        log.info("Submitted transcription of {} as external job {}", sourceRef, id);
        return id;
    }

    @Override
    public TranscriptionStatus poll(final String externalJobId) {
        if (baseUrl == null) {
            throw new PermanentIngestionException(EFailureReason.EXTERNAL_JOB_FAILED, "No transcription service configured");
        }

        final JsonNode response;
        try {
            response = restTemplate.exchange(baseUrl + JOBS_PATH + "/{id}", HttpMethod.GET,
                    new HttpEntity<>(headers()), JsonNode.class, externalJobId).getBody();
        } catch (final RestClientResponseException e) {
            throw classify(e.getStatusCode().value(), EFailureReason.EXTERNAL_JOB_FAILED, "Transcription poll", e);
        } catch (final RestClientException e) {
            throw new TransientIngestionException(EFailureReason.EXTERNAL_JOB_FAILED,
                    "Transcription service unreachable: " + e.getMessage(), e);
        }
        return parseStatus(response);
    }

    static TranscriptionStatus parseStatus(final JsonNode response) {
        if (response == null) {
            return TranscriptionStatus.pending();
        }
        final String status = response.path("status").asText("").toLowerCase(Locale.ROOT);
        switch (status) {
            case "ready", "completed", "done", "succeeded" -> {
                return TranscriptionStatus.ready(transcript(response));
            }
            case "failed", "error", "cancelled" -> {
                final String error = firstText(response, "error", "message");
                return TranscriptionStatus.failed(error != null ? error : "External job reported " + status);
            }
            case "pending", "queued", "active", "processing", "running" -> {
                return TranscriptionStatus.pending();
            }
            default -> {
                log.warn("Unknown transcription status '{}', treating as pending", status);
                return TranscriptionStatus.pending();
            }
        }
    }

    private static String transcript(final JsonNode response) {
        final String text = firstText(response, "text", "result_text");
        if (text != null) {
            return text;
        }
        final JsonNode content = response.path("content");
        if (!content.isArray()) {
            return "";
        }
        final StringBuilder joined = new StringBuilder();
        for (final JsonNode segment : content) {
            final String part = segment.isTextual() ? segment.asText() : segment.path("text").asText("");
            if (part.isBlank()) {
                continue;
            }
            if (!joined.isEmpty()) {
                joined.append(' ');
            }
            joined.append(part.strip());
        }
        return joined.toString();
    }

    private static String firstText(final JsonNode node, final String... fields) {
        for (final String field : fields) {
            final JsonNode value = node.get(field);
            if (value != null && !value.isNull() && value.isValueNode()) {
                return value.asText();
            }
        }
        return null;
    }

    /**
     * 429 and 5xx are worth retrying, any other client error is final.
     */
    private static RuntimeException classify(final int status,
                                             final EFailureReason reason,
                                             final String operation,
                                             final RestClientResponseException e) {
        final String message = operation + " returned HTTP " + status;
        if (status == 429 || status >= 500) {
            return new TransientIngestionException(reason, message, e);
        }
        return new PermanentIngestionException(reason, message, e);
    }

    private HttpHeaders headers() {
        final HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            headers.set("x-api-key", apiKey);
        }
        return headers;
    }
}
