package org.sirena.info.models;

import org.sirena.diagram.Diagram;

/**
 * Placeholder diagram shown in place of one that failed; {@code message} may be null.
 */
public record ErrorDiagram(String message) implements Diagram {

    @Override
    public String diagramType() {
        return "error";
    }

    @Override
    public boolean isValid() {
        return true;
    }
}
