package org.sirena.block.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A block, space or compound block. Compound blocks list their children in
 * declaration order and may set their own column count.
 */
public class Block {
    private final String id;
    private String label;
    private String type = "block";
    private int width = 1;
    private String parentId;
    private Integer columns;
    private String arrowDirection;
    private String style;
    private final List<String> childIds = new ArrayList<>();
    private final List<String> classes = new ArrayList<>();

    public Block(String id) {
        this.id = id;
        this.label = id;
    }

    public String getId()              { return id; }
    public String getLabel()           { return label; }
    public String getType()            { return type; }
    public int getWidth()              { return width; }
    public String getParentId()        { return parentId; }
    public Integer getColumns()        { return columns; }
    public String getArrowDirection()  { return arrowDirection; }
    public String getStyle()           { return style; }
    public List<String> getChildIds()  { return Collections.unmodifiableList(childIds); }
    public List<String> getClasses()   { return Collections.unmodifiableList(classes); }

    public void setLabel(String label)                   { this.label = label; }
    public void setType(String type)                     { this.type = type; }
    public void setWidth(int width)                      { this.width = width; }
    public void setParentId(String parentId)             { this.parentId = parentId; }
    public void setColumns(Integer columns)              { this.columns = columns; }
    public void setArrowDirection(String arrowDirection) { this.arrowDirection = arrowDirection; }
    public void setStyle(String style)                   { this.style = style; }

    public boolean isCompound() {
        return "composite".equals(type);
    }

    public void addChild(String childId) {
        if (!childIds.contains(childId)) {
            childIds.add(childId);
        }
    }

    public void addClass(String cls) {
        if (cls != null && !cls.isBlank() && !classes.contains(cls)) {
            classes.add(cls);
        }
    }

    @Override
    public String toString() {
        return "Block{id='" + id + "', type='" + type + "', width=" + width + "}";
    }
}
