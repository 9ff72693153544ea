package eu.virtualparadox.knowledge.queue;

import eu.virtualparadox.knowledge.application.config.IngestionProperties;
import eu.virtualparadox.knowledge.catalog.entity.TaskEntity;
import eu.virtualparadox.knowledge.catalog.repo.TaskRepository;
import eu.virtualparadox.knowledge.util.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@link TaskQueue} stored in the catalog database.
 * <p>
 * Claiming is a conditional update on the row version, so when several dispatchers race for the
 * same task exactly one of them wins and the others simply skip it.
 * </p>
 */
@Slf4j
@Service
public class JpaTaskQueue implements TaskQueue {

    private static final int MAX_ERROR_LENGTH = 4000;

    private final TaskRepository repository;
    private final IngestionProperties.Queue settings;
    private final RetryPolicy redeliveryBackoff;
    private final Clock clock;

    public JpaTaskQueue(final TaskRepository repository,
                        final IngestionProperties properties,
                        final Clock clock) {
        this.repository = repository;
        this.settings = properties.getQueue();
        this.redeliveryBackoff = new RetryPolicy(settings.getMaxAttempts(), settings.getRetryBackoff(),
                2.0, settings.getRetryBackoff().multipliedBy(16));
        this.clock = clock;
    }

    @Override
    @Transactional
    public String enqueue(final String taskName, final Map<String, String> payload, final Instant eta) {
        final Instant now = clock.instant();
        final TaskEntity task = TaskEntity.builder()
                .id(UUID.randomUUID().toString().replace("-", ""))
                .name(taskName)
                .payload(payload)
                .eta(eta != null ? eta : now)
                .status(ETaskStatus.READY)
                .attempts(0)
                .maxAttempts(settings.getMaxAttempts())
                .createdAt(now)
                .build();
        repository.save(task);
        log.debug("Enqueued {} {} due {}", taskName, payload, task.getEta());
        return task.getId();
    }

    @Override
    @Transactional
    public List<QueuedTask> claimDue(final int max) {
        if (max <= 0) {
            return List.of();
        }
        final Instant now = clock.instant();
        final Instant staleBefore = staleBefore(now);
        final List<TaskEntity> candidates = repository.findClaimable(
                ETaskStatus.READY, ETaskStatus.CLAIMED, now, staleBefore, PageRequest.of(0, max));

        final List<QueuedTask> claimed = new ArrayList<>(candidates.size());
        for (final TaskEntity candidate : candidates) {
            if (candidate.getStatus() == ETaskStatus.CLAIMED) {
                log.warn("Task {} ({}) was claimed at {} and never finished, delivering again",
                        candidate.getId(), candidate.getName(), candidate.getClaimedAt());
            }
            if (repository.claim(candidate.getId(), candidate.getVersion(),
                    ETaskStatus.READY, ETaskStatus.CLAIMED, now, staleBefore) == 1) {
                claimed.add(new QueuedTask(candidate.getId(), candidate.getName(), candidate.getPayload(),
                        candidate.getAttempts() + 1, candidate.getMaxAttempts()));
            }
        }
        return claimed;
    }

    @Override
    @Transactional
    public int renewClaims(final Collection<String> taskIds) {
        if (taskIds.isEmpty()) {
            return 0;
        }
        final int renewed = repository.renewClaims(taskIds, ETaskStatus.CLAIMED, clock.instant());
        log.debug("Renewed {} of {} running task claims", renewed, taskIds.size());
        return renewed;
    }

    @Override
    @Transactional
    public void complete(final String taskId) {
        repository.findById(taskId).ifPresent(task -> {
            task.setStatus(ETaskStatus.DONE);
            task.setCompletedAt(clock.instant());
            repository.save(task);
        });
    }

    @Override
    @Transactional
    public void fail(final String taskId, final String error) {
        repository.findById(taskId).ifPresent(task -> {
            final Instant now = clock.instant();
            task.setLastError(StringUtils.truncate(error, MAX_ERROR_LENGTH));
            if (task.getAttempts() >= task.getMaxAttempts()) {
                task.setStatus(ETaskStatus.DEAD);
                task.setCompletedAt(now);
                log.error("Task {} ({}) gave up after {} attempts: {}",
                        task.getId(), task.getName(), task.getAttempts(), error);
            } else {
                task.setStatus(ETaskStatus.READY);
                task.setClaimedAt(null);
                task.setEta(now.plus(redeliveryBackoff.backoffAfter(task.getAttempts())));
                log.warn("Task {} ({}) failed on attempt {}/{}, next try at {}: {}",
                        task.getId(), task.getName(), task.getAttempts(), task.getMaxAttempts(), task.getEta(), error);
            }
            repository.save(task);
        });
    }

    @Override
    @Transactional
    public void release(final String taskId) {
        repository.findById(taskId).ifPresent(task -> {
            task.setStatus(ETaskStatus.READY);
            task.setClaimedAt(null);
            task.setAttempts(Math.max(0, task.getAttempts() - 1));
            repository.save(task);
        });
    }

    @Override
    @Transactional
    public List<QueuedTask> buryAbandoned() {
        final Instant now = clock.instant();
        final List<QueuedTask> buried = new ArrayList<>();
        for (final TaskEntity task : repository.findAbandoned(ETaskStatus.CLAIMED, staleBefore(now))) {
            task.setStatus(ETaskStatus.DEAD);
            task.setCompletedAt(now);
            task.setLastError("Abandoned by its worker on the last attempt");
            repository.save(task);
            log.error("Task {} ({}) abandoned on attempt {}, giving up", task.getId(), task.getName(), task.getAttempts());
            buried.add(new QueuedTask(task.getId(), task.getName(), task.getPayload(), task.getAttempts(), task.getMaxAttempts()));
        }
        return buried;
    }

    @Override
    @Transactional
    public int purgeCompleted() {
        final int purged = repository.deleteCompletedBefore(ETaskStatus.DONE, clock.instant().minus(settings.getRetention()));
        if (purged > 0) {
            log.info("Purged {} completed tasks", purged);
        }
        return purged;
    }

    private Instant staleBefore(final Instant now) {
        return now.minus(settings.getVisibilityTimeout());
    }
}
