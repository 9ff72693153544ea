package eu.virtualparadox.knowledge.ingest.model;

/**
 * Subject-predicate-object statement between two concept labels of the same job.
 */
public record RelationTriple(String subject, String predicate, String object) {
}
