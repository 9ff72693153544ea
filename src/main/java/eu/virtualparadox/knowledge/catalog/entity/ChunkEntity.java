package eu.virtualparadox.knowledge.catalog.entity;

import eu.virtualparadox.knowledge.catalog.converter.ConceptListConverter;
import eu.virtualparadox.knowledge.catalog.converter.FloatArrayConverter;
import eu.virtualparadox.knowledge.ingest.model.Concept;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.List;

/**
 * DocumentStore row of one chunk: the chunk itself plus its staged embedding and concepts,
 * which re-indexing replays without recomputing them.
 */
@Entity
@Table(name = "chunks", indexes = {
        @Index(name = "idx_chunks_job", columnList = "job_id, sequence_index")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChunkEntity {

    @Id
    @Column(length = 96, nullable = false)
    private String id;

    @Column(name = "job_id", length = 64, nullable = false)
    private String jobId;

    @Column(name = "sequence_index", nullable = false)
    private int sequenceIndex;

    @Lob
    @Column(name = "text", nullable = false)
    private String text;

    @Column(name = "token_count", nullable = false)
    private int tokenCount;

    @Column(name = "start_offset", nullable = false)
    private int startOffset;

    @Column(name = "end_offset", nullable = false)
    private int endOffset;

    @Column(name = "degraded", nullable = false)
    private boolean degraded;

    @Column(name = "indexed", nullable = false)
    private boolean indexed;

    @Convert(converter = FloatArrayConverter.class)
    @Lob
    @Column(name = "embedding")
    private float[] embedding;

    @Column(name = "embedding_model_version", length = 128)
    private String embeddingModelVersion;

    @Convert(converter = ConceptListConverter.class)
    @Lob
    @Column(name = "concepts")
    private List<Concept> concepts;

    @Column(name = "stored_at", nullable = false)
    private Instant storedAt;
}
