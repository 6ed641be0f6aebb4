package org.sirena.flowchart.models;

/**
 * Directed connection between two nodes (or subgraphs).
 *
 * @param sourceId  id of the node the edge starts from
 * @param targetId  id of the node the edge points to
 * @param label     text shown on the edge, empty when none
 * @param arrowType one of arrow, line, dotted_arrow, dotted_line, thick_arrow, thick_line, circle_end, cross_end
 */
public record FlowchartEdge(
        String sourceId,
        String targetId,
        String label,
        String arrowType
) {
    public FlowchartEdge(String sourceId, String targetId) {
        this(sourceId, targetId, "", "arrow");
    }
}
