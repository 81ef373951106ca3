package com.linlay.goapengine.plan;

/**
 * Three-valued result of evaluating a planning condition.
 */
public enum ConditionDetermination {
    TRUE,
    FALSE,
    UNKNOWN;

    public static ConditionDetermination of(Boolean value) {
        if (value == null) {
            return UNKNOWN;
        }
        return value ? TRUE : FALSE;
    }

    public ConditionDetermination and(ConditionDetermination other) {
        if (this == FALSE || other == FALSE) {
            return FALSE;
        }
        if (this == UNKNOWN || other == UNKNOWN) {
            return UNKNOWN;
        }
        return TRUE;
    }

    public ConditionDetermination or(ConditionDetermination other) {
        if (this == TRUE || other == TRUE) {
            return TRUE;
        }
        if (this == UNKNOWN || other == UNKNOWN) {
            return UNKNOWN;
        }
        return FALSE;
    }

    public ConditionDetermination not() {
        return switch (this) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case UNKNOWN -> UNKNOWN;
        };
    }

    /**
     * Collapses UNKNOWN to FALSE for callers that need a definite answer.
     */
    public ConditionDetermination asTrueOrFalse() {
        return this == TRUE ? TRUE : FALSE;
    }
}
