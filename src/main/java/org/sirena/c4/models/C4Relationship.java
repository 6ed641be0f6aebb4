package org.sirena.c4.models;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param type  the declaring macro, e.g. {@code Rel_U} or {@code BiRel}
 * @param index 1-based position among the relationships of the diagram
 */
@Builder(toBuilder = true)
public record C4Relationship(
        String fromId,
        String toId,
        String type,
        String label,
        String technology,
        String description,
        int index,
        String sprite,
        String link,
        String tags,
        Map<String, String> styles
) {

    public C4Relationship {
        styles = styles == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(styles));
    }

    public boolean isBidirectional() {
        return type.equals("BiRel");
    }

    /** Direction hint from the macro suffix: up, down, left, right, back, or null. */
    public String direction() {
        if (type.startsWith("Rel_U")) return "up";
        if (type.startsWith("Rel_D")) return "down";
        if (type.startsWith("Rel_L")) return "left";
        if (type.startsWith("Rel_R")) return "right";
        if (type.equals("Rel_Back")) return "back";
        return null;
    }
}
