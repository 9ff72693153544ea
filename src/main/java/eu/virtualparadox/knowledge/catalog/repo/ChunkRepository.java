package eu.virtualparadox.knowledge.catalog.repo;

import eu.virtualparadox.knowledge.catalog.entity.ChunkEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ChunkRepository extends JpaRepository<ChunkEntity, String> {

    List<ChunkEntity> findByJobIdOrderBySequenceIndexAsc(String jobId);

    long countByJobId(String jobId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update ChunkEntity c set c.indexed = :indexed where c.jobId = :jobId")
    int updateIndexed(@Param("jobId") String jobId, @Param("indexed") boolean indexed);

    /**
     * Removes rows left over from an earlier run that produced more chunks.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from ChunkEntity c where c.jobId = :jobId and c.sequenceIndex >= :fromIndex")
    int deleteFromSequenceIndex(@Param("jobId") String jobId, @Param("fromIndex") int fromIndex);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from ChunkEntity c where c.jobId = :jobId")
    int deleteByJobId(@Param("jobId") String jobId);
}
