package com.linlay.goapengine.core;

/**
 * A named, typed slot on the blackboard written as {@code name:Type}.
 * A value without a colon is a type bound to the default name {@code it}.
 */
public record IoBinding(String value) {

    public static final String DEFAULT_BINDING = "it";

    public IoBinding {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("IoBinding value must not be blank");
        }
        value = value.trim();
    }

    public IoBinding(String name, String type) {
        this((name == null || name.isBlank() ? DEFAULT_BINDING : name.trim()) + ":" + type);
    }

    public IoBinding(String name, Class<?> type) {
        this(name, type.getSimpleName());
    }

    public static IoBinding of(Class<?> type) {
        return new IoBinding(DEFAULT_BINDING, type);
    }

    public String name() {
        int colon = value.indexOf(':');
        return colon < 0 ? DEFAULT_BINDING : value.substring(0, colon);
    }

    public String type() {
        int colon = value.indexOf(':');
        return colon < 0 ? value : value.substring(colon + 1);
    }

    @Override
    public String toString() {
        return value;
    }
}
