package org.sirena.state.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A state. {@code type} is one of normal, start, end, choice, fork or join; a state
 * that contains other states is additionally composite.
 */
public class StateNode {
    private final String id;
    private String label;
    private String type = "normal";
    private final List<String> descriptions = new ArrayList<>();
    private String parentId;
    private int region;
    private boolean composite;
    private final List<String> classes = new ArrayList<>();

    public StateNode(String id) {
        this.id = id;
        this.label = id;
    }

    public StateNode(String id, String type) {
        this(id);
        this.type = type;
    }

    public String getId()                 { return id; }
    public String getLabel()              { return label; }
    public String getType()               { return type; }
    public List<String> getDescriptions() { return Collections.unmodifiableList(descriptions); }
    /** Id of the enclosing composite state, null at top level. */
    public String getParentId()           { return parentId; }
    /** Concurrent region inside the parent, counted from 0 at each {@code --} separator. */
    public int getRegion()                { return region; }
    public boolean isComposite()          { return composite; }
    public List<String> getClasses()      { return Collections.unmodifiableList(classes); }

    public void setLabel(String label)       { this.label = label; }
    public void setType(String type)         { this.type = type; }
    public void setParentId(String parentId) { this.parentId = parentId; }
    public void setRegion(int region)        { this.region = region; }
    public void setComposite(boolean composite) { this.composite = composite; }

    public void addDescription(String description) {
        descriptions.add(description);
    }

    public void addClass(String cls) {
        if (!classes.contains(cls)) {
            classes.add(cls);
        }
    }

    @Override
    public String toString() {
        return "StateNode{id='" + id + "', type='" + type + "', parentId='" + parentId + "'}";
    }
}
