package eu.virtualparadox.knowledge.catalog.repo;

import eu.virtualparadox.knowledge.catalog.entity.TaskEntity;
import eu.virtualparadox.knowledge.queue.ETaskStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface TaskRepository extends JpaRepository<TaskEntity, String> {

    /**
     * Tasks that may be claimed now: ready and due, or claimed so long ago that the
     * previous owner is presumed dead and attempts are left.
     */
    @Query("select t from TaskEntity t "
            + "where (t.status = :ready and t.eta <= :now) "
            + "or (t.status = :claimed and t.claimedAt < :staleBefore and t.attempts < t.maxAttempts) "
            + "order by t.eta asc")
    List<TaskEntity> findClaimable(@Param("ready") ETaskStatus ready,
                                   @Param("claimed") ETaskStatus claimed,
                                   @Param("now") Instant now,
                                   @Param("staleBefore") Instant staleBefore,
                                   Pageable page);

    /**
     * Conditional claim: succeeds only if nobody touched the row since it was read and a
     * previous claim, if any, is still stale. A renewed claim therefore cannot be taken over.
     *
     * @return 1 if this caller now owns the task, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update TaskEntity t set t.status = :claimed, t.claimedAt = :now, "
            + "t.attempts = t.attempts + 1, t.version = t.version + 1 "
            + "where t.id = :id and t.version = :version "
            + "and (t.status = :ready or t.claimedAt < :staleBefore)")
    int claim(@Param("id") String id,
              @Param("version") Long version,
              @Param("ready") ETaskStatus ready,
              @Param("claimed") ETaskStatus claimed,
              @Param("now") Instant now,
              @Param("staleBefore") Instant staleBefore);

    /**
     * Moves the claim time of running tasks forward. The version is left alone so the owner can
     * still complete or fail its task.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update TaskEntity t set t.claimedAt = :now where t.id in :ids and t.status = :claimed")
    int renewClaims(@Param("ids") Collection<String> ids,
                    @Param("claimed") ETaskStatus claimed,
                    @Param("now") Instant now);

    /**
     * Stale claims that have used up all their attempts.
     */
    @Query("select t from TaskEntity t "
            + "where t.status = :claimed and t.claimedAt < :staleBefore and t.attempts >= t.maxAttempts")
    List<TaskEntity> findAbandoned(@Param("claimed") ETaskStatus claimed,
                                   @Param("staleBefore") Instant staleBefore);

    List<TaskEntity> findByNameAndStatus(String name, ETaskStatus status);

    long countByStatus(ETaskStatus status);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from TaskEntity t where t.status = :status and t.completedAt < :before")
    int deleteCompletedBefore(@Param("status") ETaskStatus status, @Param("before") Instant before);
}
