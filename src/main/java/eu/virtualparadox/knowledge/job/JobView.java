package eu.virtualparadox.knowledge.job;

import eu.virtualparadox.knowledge.catalog.EJobState;
import eu.virtualparadox.knowledge.catalog.entity.JobEntity;
import eu.virtualparadox.knowledge.ingest.pipeline.StageProvenance;

import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot of a job for callers outside the ingestion core.
 * {@code reason} is the stable failure code, {@code error} the human-readable message.
 */
public record JobView(String id,
                      String sourceRef,
                      EJobState state,
                      String reason,
                      String error,
                      String externalJobId,
                      int pollCount,
                      int attemptCount,
                      boolean cancelRequested,
                      int chunkCount,
                      int conceptCount,
                      String embeddingModelVersion,
                      List<StageProvenance> provenance,
                      int reindexCount,
                      boolean artifactsPurged,
                      Instant createdAt,
                      Instant updatedAt) {

    public static JobView of(final JobEntity job) {
        return new JobView(
                job.getId(),
                job.getSourceRef(),
                job.getState(),
                job.getFailureReason() != null ? job.getFailureReason().code() : null,
                job.getLastError(),
                job.getExternalJobId(),
                job.getPollCount(),
                job.getAttemptCount(),
                job.isCancelRequested(),
                job.getChunkCount(),
                job.getConceptCount(),
                job.getEmbeddingModelVersion(),
                job.getProvenance() != null ? List.copyOf(job.getProvenance()) : List.of(),
                job.getReindexCount(),
                job.isArtifactsPurged(),
                job.getCreatedAt(),
                job.getUpdatedAt());
    }
}
