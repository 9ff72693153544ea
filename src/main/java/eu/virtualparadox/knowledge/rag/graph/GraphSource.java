package eu.virtualparadox.knowledge.rag.graph;

/**
 * The source a job's graph is derived from.
 *
 * @param jobId      owning job
 * @param sourceRef  reference the job was submitted with
 * @param sourceType name of the source kind that read it, e.g. {@code file} or {@code web}
 */
public record GraphSource(String jobId, String sourceRef, String sourceType) {
}
