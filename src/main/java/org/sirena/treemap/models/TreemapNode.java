package org.sirena.treemap.models;

/**
 * @param value       declared value, null for section nodes
 * @param parentIndex position of the parent in {@link Treemap#nodes()}, -1 for roots
 */
public record TreemapNode(String label, Double value, String className, int level, int parentIndex) {

    public boolean isRoot() {
        return parentIndex < 0;
    }
}
