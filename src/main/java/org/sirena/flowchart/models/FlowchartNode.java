package org.sirena.flowchart.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A flowchart node. Mutable while the document is being read so that later
 * declarations of the same id can fill in label, shape and classes.
 */
public class FlowchartNode {
    private final String id;
    private String label;
    private String shape = "rect";
    private final List<String> classes = new ArrayList<>();

    public FlowchartNode(String id) {
        this.id = id;
        this.label = id;
    }

    public String getId()            { return id; }
    public String getLabel()         { return label; }
    public String getShape()         { return shape; }
    public List<String> getClasses() { return Collections.unmodifiableList(classes); }

    public void setLabel(String label) { this.label = label; }
    public void setShape(String shape) { this.shape = shape; }

    public void addClass(String cls) {
        if (cls != null && !cls.isBlank() && !classes.contains(cls)) {
            classes.add(cls);
        }
    }

    @Override
    public String toString() {
        return "FlowchartNode{id='" + id + "', label='" + label + "', shape='" + shape + "'}";
    }
}
