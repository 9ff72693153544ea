package eu.virtualparadox.knowledge.catalog.entity;

import eu.virtualparadox.knowledge.catalog.EJobState;
import eu.virtualparadox.knowledge.catalog.converter.IngestionOptionsConverter;
import eu.virtualparadox.knowledge.catalog.converter.IntegerListConverter;
import eu.virtualparadox.knowledge.catalog.converter.ProvenanceListConverter;
import eu.virtualparadox.knowledge.ingest.error.EFailureReason;
import eu.virtualparadox.knowledge.ingest.model.IngestionOptions;
import eu.virtualparadox.knowledge.ingest.pipeline.StageProvenance;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.List;

/**
 * Durable record of one ingestion request. Never deleted; terminal jobs stay for audit.
 * <p>
 * {@code activeKey} is set only while the job is non-terminal. Its unique constraint lets the
 * database guarantee at most one non-terminal job per {@code (sourceRef, idempotencyKey)}.
 * </p>
 */
@Entity
@Table(name = "ingestion_jobs", indexes = {
        @Index(name = "idx_jobs_source", columnList = "source_ref")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobEntity {

    @Id
    @Column(length = 64, nullable = false)
    private String id;

    @Column(name = "source_ref", length = 2048, nullable = false)
    private String sourceRef;

    @Column(name = "idempotency_key", length = 256, nullable = false)
    private String idempotencyKey;

    @Column(name = "active_key", length = 64, unique = true)
    private String activeKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", length = 32, nullable = false)
    private EJobState state;

    @Column(name = "external_job_id", length = 256)
    private String externalJobId;

    @Column(name = "external_submitted_at")
    private Instant externalSubmittedAt;

    @Column(name = "poll_count", nullable = false)
    private int pollCount;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason", length = 64)
    private EFailureReason failureReason;

    @Column(name = "last_error", length = 4000)
    private String lastError;

    @Convert(converter = IngestionOptionsConverter.class)
    @Column(name = "options", length = 1024)
    private IngestionOptions options;

    @Lob
    @Column(name = "content_text")
    private String contentText;

    @Convert(converter = IntegerListConverter.class)
    @Lob
    @Column(name = "section_starts")
    private List<Integer> sectionStarts;

    @Column(name = "chunk_count", nullable = false)
    private int chunkCount;

    @Column(name = "concept_count", nullable = false)
    private int conceptCount;

    @Column(name = "embedding_model_version", length = 128)
    private String embeddingModelVersion;

    @Convert(converter = ProvenanceListConverter.class)
    @Lob
    @Column(name = "provenance")
    private List<StageProvenance> provenance;

    @Column(name = "reindex_count", nullable = false)
    private int reindexCount;

    @Column(name = "artifacts_purged", nullable = false)
    private boolean artifactsPurged;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    @PrePersist
    void prePersist() {
        if (state == null) {
            state = EJobState.SUBMITTED;
        }
        if (options == null) {
            options = IngestionOptions.defaults();
        }
    }
}
