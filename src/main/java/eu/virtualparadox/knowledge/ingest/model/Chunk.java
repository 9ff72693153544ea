package eu.virtualparadox.knowledge.ingest.model;

/**
 * Immutable contiguous span of normalized source text produced by the chunker.
 *
 * @param id            deterministic identifier, see {@link #buildId(String, int)}
 * @param jobId         owning job
 * @param sequenceIndex 0-based position in document order
 * @param text          exact substring {@code [startOffset, endOffset)} of the normalized text
 * @param tokenCount    number of tokens in {@code text}
 * @param startOffset   inclusive start offset into the normalized text (overlap included)
 * @param endOffset     exclusive end offset into the normalized text
 * @param degraded      {@code true} when produced by a hard cut of an oversized sentence
 */
public record Chunk(String id,
                    String jobId,
                    int sequenceIndex,
                    String text,
                    int tokenCount,
                    int startOffset,
                    int endOffset,
                    boolean degraded) {

    /**
     * Builds a stable chunk identifier:
     * <pre>
     *   {jobId}_{seq(5 digits)}
     * </pre>
     * Re-processing the same job therefore overwrites rather than duplicates.
     */
    public static String buildId(final String jobId, final int sequenceIndex) {
        return jobId + "_" + String.format("%05d", sequenceIndex);
    }
}
