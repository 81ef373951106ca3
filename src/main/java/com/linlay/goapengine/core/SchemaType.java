package com.linlay.goapengine.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A type known only by name and properties, with no backing JVM class.
 */
public record SchemaType(
        String name,
        String description,
        List<PropertyDefinition> properties
) implements DomainType {

    public SchemaType {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("SchemaType name must not be blank");
        }
        description = description == null ? name : description;
        properties = properties == null ? List.of() : List.copyOf(properties);
    }

    public SchemaType(String name) {
        this(name, name, List.of());
    }

    public SchemaType withProperty(PropertyDefinition property) {
        List<PropertyDefinition> next = new ArrayList<>(properties);
        next.add(property);
        return new SchemaType(name, description, next);
    }

    /**
     * Union of both property lists by property name. This type's definitions win on conflict.
     */
    public SchemaType merge(SchemaType other) {
        if (!name.equals(other.name())) {
            throw new IllegalArgumentException("Cannot merge SchemaType " + name + " with " + other.name());
        }
        Map<String, PropertyDefinition> merged = new LinkedHashMap<>();
        for (PropertyDefinition property : properties) {
            merged.put(property.name(), property);
        }
        for (PropertyDefinition property : other.properties()) {
            merged.putIfAbsent(property.name(), property);
        }
        return new SchemaType(name, description, new ArrayList<>(merged.values()));
    }
}
