package eu.virtualparadox.knowledge.ingest.pipeline;

/**
 * Single-responsibility transform that the {@link Pipeline} composes in sequence.
 * <p>
 * Implementations must be deterministic for identical input and configuration and must not
 * perform external writes, so a failed stage can simply be run again. Failures are reported as
 * {@link eu.virtualparadox.knowledge.ingest.error.TransientIngestionException} (worth retrying) or
 * {@link eu.virtualparadox.knowledge.ingest.error.PermanentIngestionException} (not).
 * </p>
 *
 * @param <I> input type
 * @param <O> output type
 */
public interface Processor<I, O> {

    /**
     * Stable stage name, recorded in the job's provenance.
     */
    String name();

    O process(I input);
}
