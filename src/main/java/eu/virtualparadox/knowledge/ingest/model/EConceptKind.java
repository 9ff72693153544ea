package eu.virtualparadox.knowledge.ingest.model;

public enum EConceptKind {
    ENTITY,
    RELATION
}
