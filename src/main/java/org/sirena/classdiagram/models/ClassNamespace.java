package org.sirena.classdiagram.models;

import java.util.List;

public record ClassNamespace(String name, List<String> classIds) {
    public ClassNamespace {
        classIds = classIds == null ? List.of() : List.copyOf(classIds);
    }
}
