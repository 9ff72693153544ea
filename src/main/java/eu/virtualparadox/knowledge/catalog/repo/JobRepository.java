package eu.virtualparadox.knowledge.catalog.repo;

import eu.virtualparadox.knowledge.catalog.entity.JobEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface JobRepository extends JpaRepository<JobEntity, String> {

    Optional<JobEntity> findByActiveKey(String activeKey);
}
