package eu.virtualparadox.knowledge.rag.graph;

/**
 * RDF-like statement. Subjects and predicates are prefixed names, objects are prefixed names
 * or plain literals.
 */
public record Triple(String subject, String predicate, String object) {
}
