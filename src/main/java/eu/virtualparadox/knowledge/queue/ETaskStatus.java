package eu.virtualparadox.knowledge.queue;

public enum ETaskStatus {
    /** Waiting for its eta. */
    READY,
    /** Owned by a worker. */
    CLAIMED,
    DONE,
    /** Gave up after the maximum number of attempts. */
    DEAD
}
