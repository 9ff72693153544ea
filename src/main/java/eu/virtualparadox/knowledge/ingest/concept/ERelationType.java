package eu.virtualparadox.knowledge.ingest.concept;

import java.util.Locale;

/**
 * Closed set of relation predicates. Anything the model invents maps to {@link #RELATED_TO}.
 */
public enum ERelationType {
    IS_A("is_a"),
    PART_OF("part_of"),
    PREREQUISITE_FOR("prerequisite_for"),
    USED_IN("used_in"),
    OPPOSITE_OF("opposite_of"),
    RELATED_TO("related_to");

    private final String predicate;

    ERelationType(final String predicate) {
        this.predicate = predicate;
    }

    public String predicate() {
        return predicate;
    }

    /**
     * Normalizes a raw predicate: case, surrounding blanks, spaces and dashes are ignored,
     * so {@code "Is-A"} and {@code "is a"} both yield {@link #IS_A}.
     */
    public static ERelationType fromPredicate(final String raw) {
        if (raw == null) {
            return RELATED_TO;
        }
        final String key = raw.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        for (final ERelationType type : values()) {
            if (type.predicate.equals(key)) {
                return type;
            }
        }
        return RELATED_TO;
    }
}
