package org.sirena.er.models;

import lombok.Builder;

/**
 * @param cardinalityFrom  one, zero_or_one, zero_or_more or one_or_more, at the source end
 * @param cardinalityTo    same vocabulary, at the target end
 * @param relationshipType identifying or non-identifying
 */
@Builder
public record ErRelationship(
        String fromId,
        String toId,
        String cardinalityFrom,
        String cardinalityTo,
        String relationshipType,
        String label
) {
    public ErRelationship {
        label = label == null ? "" : label;
    }

    public boolean isIdentifying() {
        return "identifying".equals(relationshipType);
    }
}
