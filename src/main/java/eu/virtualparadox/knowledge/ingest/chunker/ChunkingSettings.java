package eu.virtualparadox.knowledge.ingest.chunker;

import eu.virtualparadox.knowledge.ingest.error.EFailureReason;
import eu.virtualparadox.knowledge.ingest.error.PermanentIngestionException;
import eu.virtualparadox.knowledge.ingest.model.IngestionOptions;

/**
 * Token budget and overlap used for one job.
 *
 * @param tokenBudget   maximum tokens per chunk, must be positive
 * @param overlapTokens maximum tokens carried from the tail of a chunk into the next one,
 *                      must be {@code >= 0} and {@code < tokenBudget}
 */
public record ChunkingSettings(int tokenBudget, int overlapTokens) {

    public ChunkingSettings {
        if (tokenBudget <= 0) {
            throw new PermanentIngestionException(EFailureReason.INVALID_OPTIONS,
                    "chunk_token_budget must be positive, got " + tokenBudget);
        }
        if (overlapTokens < 0 || overlapTokens >= tokenBudget) {
            throw new PermanentIngestionException(EFailureReason.INVALID_OPTIONS,
                    "chunk_overlap must be >= 0 and < chunk_token_budget (" + tokenBudget + "), got " + overlapTokens);
        }
    }

    /**
     * Applies per-job overrides on top of the configured defaults.
     */
    public static ChunkingSettings resolve(final int defaultBudget,
                                           final int defaultOverlap,
                                           final IngestionOptions options) {
        final int budget = options.chunkTokenBudget() != null ? options.chunkTokenBudget() : defaultBudget;
        final int overlap = options.chunkOverlap() != null ? options.chunkOverlap() : defaultOverlap;
        return new ChunkingSettings(budget, overlap);
    }
}
