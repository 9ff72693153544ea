package eu.virtualparadox.knowledge.catalog.entity;

import eu.virtualparadox.knowledge.catalog.converter.StringMapConverter;
import eu.virtualparadox.knowledge.queue.ETaskStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Map;

/**
 * Durable queue entry. Claiming bumps {@code version}, so two workers can never both own it.
 */
@Entity
@Table(name = "ingestion_tasks", indexes = {
        @Index(name = "idx_tasks_due", columnList = "status, eta")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskEntity {

    @Id
    @Column(length = 64, nullable = false)
    private String id;

    @Column(name = "name", length = 128, nullable = false)
    private String name;

    @Convert(converter = StringMapConverter.class)
    @Column(name = "payload", length = 4000)
    private Map<String, String> payload;

    @Column(name = "eta", nullable = false)
    private Instant eta;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 16, nullable = false)
    private ETaskStatus status;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Column(name = "last_error", length = 4000)
    private String lastError;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    private Long version;
}
