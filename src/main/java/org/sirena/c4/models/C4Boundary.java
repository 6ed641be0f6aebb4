package org.sirena.c4.models;

/**
 * A boundary or deployment node grouping elements.
 *
 * @param type boundary kind: enterprise, system, container, a free-form type given to
 *             {@code Boundary}, or the node type of a deployment node
 */
public record C4Boundary(
        String id,
        String macro,
        String label,
        String type,
        String description,
        String parentId,
        String tags,
        String link
) {

    public boolean isDeploymentNode() {
        return macro.startsWith("Deployment_Node") || macro.startsWith("Node");
    }
}
