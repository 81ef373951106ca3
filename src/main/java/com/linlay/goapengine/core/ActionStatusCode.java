package com.linlay.goapengine.core;

public enum ActionStatusCode {
    SUCCEEDED,
    FAILED,
    WAITING,
    PAUSED
}
