package org.sirena.classdiagram.models;

import lombok.Builder;

@Builder
public record ClassMethod(
        String name,
        String parameters,
        String returnType,
        String visibility,
        boolean isStatic,
        boolean isAbstract
) {
    public ClassMethod {
        parameters = parameters == null ? "" : parameters;
        returnType = returnType == null ? "" : returnType;
    }
}
