package com.linlay.goapengine.core;

/**
 * A type that can appear in action inputs and outputs.
 */
public sealed interface DomainType permits SchemaType, JvmType {

    String name();

    String description();
}
