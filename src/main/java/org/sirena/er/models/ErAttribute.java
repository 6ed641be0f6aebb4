package org.sirena.er.models;

import java.util.List;

/**
 * @param keys any of PK, FK and UK
 */
public record ErAttribute(String name, String type, List<String> keys, String comment) {

    public ErAttribute {
        keys = keys == null ? List.of() : List.copyOf(keys);
    }

    public boolean isPrimaryKey() {
        return keys.contains("PK");
    }

    public boolean isForeignKey() {
        return keys.contains("FK");
    }
}
