package eu.virtualparadox.knowledge.catalog.service;

import eu.virtualparadox.knowledge.catalog.EJobState;
import eu.virtualparadox.knowledge.catalog.entity.JobEntity;
import eu.virtualparadox.knowledge.catalog.repo.JobRepository;
import eu.virtualparadox.knowledge.ingest.error.EFailureReason;
import eu.virtualparadox.knowledge.ingest.model.IngestionOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Service layer over the durable job records.
 * <p>
 * Every state change goes through {@link #transition(String, Set, Consumer)}, which only applies
 * the change when the job is still in one of the expected states. Duplicate task deliveries
 * therefore find the job elsewhere and become no-ops.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobCatalogService {

    /** States a cancellation request completes immediately, as no work is in flight. */
    private static final Set<EJobState> CANCEL_IMMEDIATELY =
            EnumSet.of(EJobState.SUBMITTED, EJobState.EXTERNAL_PENDING, EJobState.CONTENT_READY);

    /** States where cancellation is picked up at the next checkpoint. */
    private static final Set<EJobState> CANCEL_AT_CHECKPOINT =
            EnumSet.of(EJobState.EXTERNAL_POLLING, EJobState.PROCESSING);

    /** Every non-terminal state. */
    public static final Set<EJobState> ACTIVE_STATES = EnumSet.complementOf(
            EnumSet.of(EJobState.INDEXED, EJobState.INDEXED_DEGRADED, EJobState.FAILED, EJobState.CANCELLED));

    private static final int MAX_ERROR_LENGTH = 4000;

    private final JobRepository repository;
    private final Clock clock;

    /**
     * Looks up the non-terminal job registered for a source and idempotency key.
     */
    @Transactional(readOnly = true)
    public Optional<JobEntity> findActive(final String sourceRef, final String idempotencyKey) {
        return repository.findByActiveKey(activeKey(sourceRef, idempotencyKey));
    }

    /**
     * Persists a new job in {@link EJobState#SUBMITTED}.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException if another non-terminal job
     *                                                                  already holds the same key
     */
    @Transactional
    public JobEntity create(final String sourceRef,
                            final String idempotencyKey,
                            final IngestionOptions options) {
        final Instant now = clock.instant();
        final JobEntity job = JobEntity.builder()
                .id(generateId())
                .sourceRef(sourceRef)
                .idempotencyKey(idempotencyKey)
                .activeKey(activeKey(sourceRef, idempotencyKey))
                .state(EJobState.SUBMITTED)
                .options(options != null ? options : IngestionOptions.defaults())
                .createdAt(now)
                .updatedAt(now)
                .build();
        return repository.saveAndFlush(job);
    }

    @Transactional(readOnly = true)
    public Optional<JobEntity> find(final String id) {
        return repository.findById(id);
    }

    /**
     * Applies {@code mutation} if the job is currently in one of {@code from}.
     * <p>
     * The mutation is expected to set the new state. Entering a terminal state releases the
     * job's idempotency slot.
     * </p>
     *
     * @return the updated job, or empty if the job is unknown or in an unexpected state
     */
    @Transactional
    public Optional<JobEntity> transition(final String id,
                                          final Set<EJobState> from,
                                          final Consumer<JobEntity> mutation) {
        final Optional<JobEntity> found = repository.findById(id);
        if (found.isEmpty()) {
            log.warn("Job {} not found", id);
            return Optional.empty();
        }

        final JobEntity job = found.get();
        if (!from.contains(job.getState())) {
            log.debug("Job {} is {}, expected one of {}; skipping", id, job.getState(), from);
            return Optional.empty();
        }

        final EJobState before = job.getState();
        mutation.accept(job);
        job.setUpdatedAt(clock.instant());
        if (job.getState().isTerminal()) {
            job.setActiveKey(null);
        }

        final JobEntity saved = repository.saveAndFlush(job);
        if (before != saved.getState()) {
            log.info("Job {}: {} -> {}", id, before, saved.getState());
        }
        return Optional.of(saved);
    }

    /**
     * Moves a non-terminal job to {@link EJobState#FAILED}.
     */
    @Transactional
    public Optional<JobEntity> fail(final String id, final EFailureReason reason, final String message) {
        return transition(id, ACTIVE_STATES, job -> {
            job.setState(EJobState.FAILED);
            job.setFailureReason(reason);
            job.setLastError(StringUtils.truncate(message, MAX_ERROR_LENGTH));
        });
    }

    /**
     * Moves a non-terminal job to {@link EJobState#CANCELLED}.
     */
    @Transactional
    public Optional<JobEntity> markCancelled(final String id) {
        return transition(id, ACTIVE_STATES, job -> {
            job.setState(EJobState.CANCELLED);
            job.setLastError("Cancelled on request");
        });
    }

    /**
     * Records a cancellation request.
     * <p>
     * Jobs with no work in flight are cancelled at once. Polling and processing jobs get the
     * {@code cancelRequested} flag and stop at their next checkpoint. Jobs already writing
     * finish their write; terminal jobs are left alone.
     * </p>
     *
     * @return the job after the request was applied, or empty if it is unknown
     */
    @Transactional
    public Optional<JobEntity> cancel(final String id) {
        final Optional<JobEntity> found = repository.findById(id);
        if (found.isEmpty()) {
            return Optional.empty();
        }

        final JobEntity job = found.get();
        if (CANCEL_IMMEDIATELY.contains(job.getState())) {
            return markCancelled(id);
        }
        if (CANCEL_AT_CHECKPOINT.contains(job.getState())) {
            return transition(id, CANCEL_AT_CHECKPOINT, j -> j.setCancelRequested(true));
        }

        log.info("Job {} is {}, cancellation has no effect", id, job.getState());
        return Optional.of(job);
    }

    @Transactional(readOnly = true)
    public boolean isCancelRequested(final String id) {
        return repository.findById(id)
                .map(job -> job.isCancelRequested() || job.getState() == EJobState.CANCELLED)
                .orElse(false);
    }

    /**
     * Stable hash identifying a {@code (sourceRef, idempotencyKey)} pair.
     */
    public static String activeKey(final String sourceRef, final String idempotencyKey) {
        try {
            final MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(sourceRef.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(idempotencyKey.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private String generateId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
