package com.linlay.goapengine.spi;

public enum StuckHandlingResultCode {
    /**
     * The handler changed something; plan again.
     */
    REPLAN,
    NO_RESOLUTION
}
