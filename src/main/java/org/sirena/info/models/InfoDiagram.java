package org.sirena.info.models;

import org.sirena.diagram.Diagram;

public record InfoDiagram(boolean showInfo) implements Diagram {

    @Override
    public String diagramType() {
        return "info";
    }

    @Override
    public boolean isValid() {
        return true;
    }
}
