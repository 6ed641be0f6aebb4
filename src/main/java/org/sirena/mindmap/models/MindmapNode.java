package org.sirena.mindmap.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A mindmap entry. Parents are referenced by position in {@link Mindmap#nodes()}.
 */
public class MindmapNode {
    private final String id;
    private final String text;
    private final String shape;
    private int level;
    private int parentIndex = -1;
    private String icon;
    private final List<String> classes = new ArrayList<>();

    public MindmapNode(String id, String text, String shape) {
        this.id = id;
        this.text = text;
        this.shape = shape;
    }

    public String getId()            { return id; }
    public String getText()          { return text; }
    /** default, square, rounded, circle, bang, cloud or hexagon. */
    public String getShape()         { return shape; }
    public int getLevel()            { return level; }
    /** Index of the parent node, -1 for a root. */
    public int getParentIndex()      { return parentIndex; }
    public String getIcon()          { return icon; }
    public List<String> getClasses() { return Collections.unmodifiableList(classes); }

    public void setLevel(int level)             { this.level = level; }
    public void setParentIndex(int parentIndex) { this.parentIndex = parentIndex; }
    public void setIcon(String icon)            { this.icon = icon; }

    public void addClass(String cls) {
        if (!cls.isBlank()) {
            classes.add(cls);
        }
    }

    @Override
    public String toString() {
        return "MindmapNode{id='" + id + "', text='" + text + "', level=" + level + "}";
    }
}
