package eu.virtualparadox.knowledge.catalog.service;

import eu.virtualparadox.knowledge.catalog.entity.ChunkEntity;
import eu.virtualparadox.knowledge.catalog.repo.ChunkRepository;
import eu.virtualparadox.knowledge.ingest.error.StoreException;
import eu.virtualparadox.knowledge.ingest.model.Chunk;
import eu.virtualparadox.knowledge.ingest.model.Embedding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link DocumentStore} backed by the relational catalog (H2 through Spring Data JPA).
 * <p>
 * Chunk rows also carry the staged embedding and concepts so that re-indexing can replay
 * the vector and graph writes without recomputing anything.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaDocumentStore implements DocumentStore {

    private final ChunkRepository repository;
    private final Clock clock;

    @Override
    @Transactional
    public void putChunk(final StoredChunk chunk) {
        guarded("putChunk " + chunk.chunk().id(), () -> {
            repository.saveAndFlush(toEntity(chunk, clock.instant()));
            return null;
        });
    }

    @Override
    @Transactional
    public void putChunks(final String jobId, final List<StoredChunk> chunks) {
        guarded("putChunks " + jobId, () -> {
            final Instant now = clock.instant();
            for (final StoredChunk chunk : chunks) {
                if (!jobId.equals(chunk.chunk().jobId())) {
                    throw new IllegalArgumentException("Chunk " + chunk.chunk().id() + " does not belong to job " + jobId);
                }
                repository.save(toEntity(chunk, now));
            }
            repository.flush();

            final int stale = repository.deleteFromSequenceIndex(jobId, chunks.size());
            if (stale > 0) {
                log.info("Removed {} stale chunks of job {}", stale, jobId);
            }
            return null;
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StoredChunk> getChunk(final String chunkId) {
        return guarded("getChunk " + chunkId, () -> repository.findById(chunkId).map(this::toStoredChunk));
    }

    @Override
    @Transactional(readOnly = true)
    public List<StoredChunk> listChunks(final String jobId) {
        return guarded("listChunks " + jobId, () -> repository.findByJobIdOrderBySequenceIndexAsc(jobId)
                .stream()
                .map(this::toStoredChunk)
                .toList());
    }

    @Override
    @Transactional
    public void markIndexed(final String jobId, final boolean indexed) {
        guarded("markIndexed " + jobId, () -> repository.updateIndexed(jobId, indexed));
    }

    @Override
    @Transactional
    public void deleteByJobId(final String jobId) {
        guarded("deleteByJobId " + jobId, () -> repository.deleteByJobId(jobId));
    }

    private <T> T guarded(final String operation, final Supplier<T> body) {
        try {
            return body.get();
        } catch (final DataAccessException e) {
            throw new StoreException("DocumentStore " + operation + " failed", e);
        }
    }

    private ChunkEntity toEntity(final StoredChunk stored, final Instant now) {
        final Chunk c = stored.chunk();
        final Embedding e = stored.embedding();
        return ChunkEntity.builder()
                .id(c.id())
                .jobId(c.jobId())
                .sequenceIndex(c.sequenceIndex())
                .text(c.text())
                .tokenCount(c.tokenCount())
                .startOffset(c.startOffset())
                .endOffset(c.endOffset())
                .degraded(c.degraded())
                .indexed(stored.indexed())
                .embedding(e != null ? e.vector() : null)
                .embeddingModelVersion(e != null ? e.modelVersion() : null)
                .concepts(stored.concepts())
                .storedAt(now)
                .build();
    }

    private StoredChunk toStoredChunk(final ChunkEntity entity) {
        final Chunk chunk = new Chunk(
                entity.getId(),
                entity.getJobId(),
                entity.getSequenceIndex(),
                entity.getText(),
                entity.getTokenCount(),
                entity.getStartOffset(),
                entity.getEndOffset(),
                entity.isDegraded());
        final Embedding embedding = entity.getEmbedding() != null
                ? new Embedding(entity.getId(), entity.getEmbedding(), entity.getEmbeddingModelVersion())
                : null;
        return new StoredChunk(chunk, embedding, entity.getConcepts(), entity.isIndexed());
    }
}
