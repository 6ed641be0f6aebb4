package org.sirena.architecture.models;

import lombok.Builder;

/**
 * @param fromSide one of L, R, T, B, or null when the side is left to the layout
 * @param fromArrow an arrow head is drawn at the source end
 */
@Builder
public record ArchitectureEdge(
        String fromId,
        String fromSide,
        boolean fromArrow,
        String toId,
        String toSide,
        boolean toArrow,
        String label
) {
}
