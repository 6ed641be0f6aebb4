package org.sirena.classdiagram.models;

import lombok.Builder;

/**
 * Relationship between two classes. Left-pointing operators are normalised so that the
 * source is always the specialised, owning or depending side.
 *
 * @param type inheritance, composition, aggregation, realization, dependency or association
 */
@Builder
public record ClassRelationship(
        String sourceId,
        String targetId,
        String type,
        String operator,
        String label,
        String sourceCardinality,
        String targetCardinality
) {
    public ClassRelationship {
        label = label == null ? "" : label;
    }
}
