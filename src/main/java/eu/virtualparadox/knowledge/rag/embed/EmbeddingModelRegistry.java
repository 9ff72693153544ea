package eu.virtualparadox.knowledge.rag.embed;

import eu.virtualparadox.knowledge.application.config.IngestionProperties;
import eu.virtualparadox.knowledge.ingest.error.EFailureReason;
import eu.virtualparadox.knowledge.ingest.error.PermanentIngestionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Looks up embedding models by their version string.
 * <p>
 * A job that names no model gets the configured default
 * ({@code knowledge.ingestion.embedding.default-model}, or the first registered model when blank).
 * </p>
 */
@Service
@Slf4j
public class EmbeddingModelRegistry {

    private final Map<String, EmbeddingService> models = new LinkedHashMap<>();
    private final String defaultVersion;

    public EmbeddingModelRegistry(final List<EmbeddingService> services, final IngestionProperties properties) {
        for (final EmbeddingService service : services) {
            models.put(service.modelVersion(), service);
        }
        if (models.isEmpty()) {
            throw new IllegalStateException("No embedding model registered");
        }

        final String configured = properties.getEmbedding().getDefaultModel();
        if (configured == null || configured.isBlank()) {
            this.defaultVersion = models.keySet().iterator().next();
        } else if (models.containsKey(configured)) {
            this.defaultVersion = configured;
        } else {
            throw new IllegalStateException("Default embedding model " + configured
                    + " is not registered, available: " + models.keySet());
        }
        log.info("Embedding models available: {}, default {}", models.keySet(), defaultVersion);
    }

    /**
     * Resolves the model for a job.
     *
     * @param requestedVersion version from the job options, {@code null} or blank for the default
     * @return the embedding service
     * @throws PermanentIngestionException with {@code unsupported_embedding_model} for unknown versions
     */
    public EmbeddingService resolve(final String requestedVersion) {
        final String version = requestedVersion == null || requestedVersion.isBlank() ? defaultVersion : requestedVersion;
        final EmbeddingService service = models.get(version);
        if (service == null) {
            throw new PermanentIngestionException(EFailureReason.UNSUPPORTED_EMBEDDING_MODEL,
                    "Unknown embedding model version " + version + ", available: " + models.keySet());
        }
        return service;
    }

    public String defaultVersion() {
        return defaultVersion;
    }

    public Set<String> versions() {
        return models.keySet();
    }
}
