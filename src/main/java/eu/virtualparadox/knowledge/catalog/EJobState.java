package eu.virtualparadox.knowledge.catalog;

import java.util.EnumSet;
import java.util.Set;

/**
 * Ingestion job lifecycle.
 * <pre>
 * SUBMITTED → (EXTERNAL_PENDING ⇄ EXTERNAL_POLLING)? → CONTENT_READY → PROCESSING → WRITING → INDEXED | INDEXED_DEGRADED
 * </pre>
 * {@link #FAILED} and {@link #CANCELLED} are reachable from every non-terminal state.
 */
public enum EJobState {
    SUBMITTED,
    EXTERNAL_PENDING,
    EXTERNAL_POLLING,
    CONTENT_READY,
    PROCESSING,
    WRITING,
    INDEXED,
    INDEXED_DEGRADED,
    FAILED,
    CANCELLED;

    private static final Set<EJobState> TERMINAL = EnumSet.of(INDEXED, INDEXED_DEGRADED, FAILED, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
