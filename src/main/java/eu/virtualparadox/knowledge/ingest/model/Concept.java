package eu.virtualparadox.knowledge.ingest.model;

/**
 * An entity or relation extracted from one chunk.
 *
 * @param id      deterministic identifier {@code {chunkId}_c{nn}}
 * @param chunkId source chunk
 * @param label   entity label, or the predicate for relations
 * @param kind    entity or relation
 * @param triple  the relation statement when {@code kind == RELATION}, otherwise {@code null}
 */
public record Concept(String id, String chunkId, String label, EConceptKind kind, RelationTriple triple) {

    public static Concept entity(final String chunkId, final int ordinal, final String label) {
        return new Concept(buildId(chunkId, ordinal), chunkId, label, EConceptKind.ENTITY, null);
    }

    public static Concept relation(final String chunkId, final int ordinal, final RelationTriple triple) {
        return new Concept(buildId(chunkId, ordinal), chunkId, triple.predicate(), EConceptKind.RELATION, triple);
    }

    private static String buildId(final String chunkId, final int ordinal) {
        return chunkId + "_c" + String.format("%02d", ordinal);
    }
}
