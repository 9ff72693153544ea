package eu.virtualparadox.knowledge.ingest.concept;

/**
 * Per-chunk caps applied to the model's answer.
 *
 * @param maxEntities   maximum entity concepts, relation endpoints included
 * @param maxRelations  maximum relations
 * @param minConfidence relations below this confidence are dropped
 */
public record ConceptLimits(int maxEntities, int maxRelations, double minConfidence) {

    public static ConceptLimits defaults() {
        return new ConceptLimits(6, 3, 0.8);
    }
}
