package eu.virtualparadox.knowledge.ingest.pipeline;

/**
 * Asked by the {@link Pipeline} between stages whether the job should stop.
 */
@FunctionalInterface
public interface CancellationCheck {

    CancellationCheck NEVER = () -> false;

    boolean isCancelled();
}
