package org.sirena.c4.models;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A person, system, container or component.
 *
 * @param type       the declaring macro, e.g. {@code SystemDb_Ext}
 * @param boundaryId innermost enclosing boundary, null at top level
 * @param styles     overrides from {@code UpdateElementStyle}
 */
@Builder(toBuilder = true)
public record C4Element(
        String id,
        String type,
        String label,
        String description,
        String technology,
        String sprite,
        String link,
        String tags,
        String boundaryId,
        Map<String, String> styles
) {

    public C4Element {
        styles = styles == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(styles));
    }

    public boolean isExternal() {
        return type.endsWith("_Ext");
    }

    /** person, system, container or component */
    public String kind() {
        String base = type.replace("_Ext", "");
        if (base.startsWith("Person")) return "person";
        if (base.startsWith("System")) return "system";
        if (base.startsWith("Container")) return "container";
        return "component";
    }
}
