package com.linlay.goapengine.core;

public record JvmType(Class<?> clazz) implements DomainType {

    public JvmType {
        if (clazz == null) {
            throw new IllegalArgumentException("clazz must not be null");
        }
    }

    @Override
    public String name() {
        return clazz.getSimpleName();
    }

    @Override
    public String description() {
        return clazz.getName();
    }
}
