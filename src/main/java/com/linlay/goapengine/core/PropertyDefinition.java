package com.linlay.goapengine.core;

public record PropertyDefinition(
        String name,
        String type,
        String description
) {
    public PropertyDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Property name must not be blank");
        }
        type = type == null || type.isBlank() ? "string" : type;
        description = description == null ? name : description;
    }

    public PropertyDefinition(String name) {
        this(name, "string", name);
    }
}
