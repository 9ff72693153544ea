package eu.virtualparadox.knowledge.ingest.concept;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Raw answer of the concept model for one chunk, before filtering.
 *
 * @param concepts      entity labels in the order the model ranked them
 * @param relationships candidate relations with the model's confidence
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConceptModelResult(
        @JsonProperty("concepts") List<String> concepts,
        @JsonProperty("relationships") List<Relationship> relationships) {

    public ConceptModelResult {
        concepts = concepts == null ? List.of() : concepts;
        relationships = relationships == null ? List.of() : relationships;
    }

    public static ConceptModelResult empty() {
        return new ConceptModelResult(List.of(), List.of());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Relationship(
            @JsonProperty("source_concept") String sourceConcept,
            @JsonProperty("relation_type") String relationType,
            @JsonProperty("target_concept") String targetConcept,
            @JsonProperty("confidence") Double confidence) {

        /**
         * Missing confidence counts as certain.
         */
        public double confidenceOrDefault() {
            return confidence == null ? 1.0 : confidence;
        }
    }
}
