package com.linlay.goapengine.core.hitl;

public enum ResponseImpact {
    UPDATED,
    UNCHANGED
}
