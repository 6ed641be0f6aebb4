package org.sirena.er.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ErEntity {
    private final String id;
    private String label;
    private final List<ErAttribute> attributes = new ArrayList<>();

    public ErEntity(String id) {
        this.id = id;
        this.label = id;
    }

    public String getId()                   { return id; }
    public String getLabel()                { return label; }
    public List<ErAttribute> getAttributes() { return Collections.unmodifiableList(attributes); }

    public void setLabel(String label) { this.label = label; }

    /** Adds the attribute, replacing an earlier one with the same name. */
    public void putAttribute(ErAttribute attribute) {
        attributes.removeIf(a -> a.name().equals(attribute.name()));
        attributes.add(attribute);
    }

    public List<ErAttribute> primaryKeys() {
        return attributes.stream().filter(ErAttribute::isPrimaryKey).toList();
    }

    @Override
    public String toString() {
        return "ErEntity{id='" + id + "', attributes=" + attributes + "}";
    }
}
