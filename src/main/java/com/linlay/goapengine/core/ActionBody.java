package com.linlay.goapengine.core;

@FunctionalInterface
public interface ActionBody {

    ActionResult execute(OperationContext context);
}
