package org.sirena.diagram;

/**
 * Common contract of every diagram model handed to the layout stage.
 */
public interface Diagram {

    /** Registry key of the notation, e.g. {@code "flowchart"}. */
    String diagramType();

    /**
     * Advisory referential check. An invalid model is still returned by the parser;
     * callers decide whether to render it.
     */
    boolean isValid();
}
