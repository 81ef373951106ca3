package com.linlay.goapengine.spi;

import java.time.Duration;
import java.time.Instant;

/**
 * When an action may run.
 */
public sealed interface ActionExecutionSchedule
        permits ActionExecutionSchedule.Pronto, ActionExecutionSchedule.Delayed, ActionExecutionSchedule.Scheduled {

    ActionExecutionSchedule PRONTO = new Pronto();

    record Pronto() implements ActionExecutionSchedule {
    }

    record Delayed(Duration delay) implements ActionExecutionSchedule {
        public Delayed {
            delay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        }
    }

    /**
     * Run later; the process pauses instead of executing now.
     */
    record Scheduled(Instant at) implements ActionExecutionSchedule {
    }
}
