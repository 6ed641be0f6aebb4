package org.sirena.quadrant.models;

import lombok.Builder;

/**
 * A plotted point; coordinates are fractions of the chart in 0..1.
 */
@Builder
public record QuadrantPoint(
        String label,
        double x,
        double y,
        String className,
        Double radius,
        String color,
        String strokeColor,
        String strokeWidth
) {
    /**
     * Quadrant number as used by {@code quadrant-N}: 1 top right, 2 top left,
     * 3 bottom left, 4 bottom right.
     */
    public int quadrant() {
        boolean right = x >= 0.5;
        boolean top = y >= 0.5;
        if (top) {
            return right ? 1 : 2;
        }
        return right ? 4 : 3;
    }
}
