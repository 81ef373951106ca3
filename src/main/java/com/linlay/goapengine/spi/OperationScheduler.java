package com.linlay.goapengine.spi;

import com.linlay.goapengine.event.ActionExecutionStartEvent;

/**
 * Consulted before every action execution.
 */
@FunctionalInterface
public interface OperationScheduler {

    OperationScheduler PRONTO = event -> ActionExecutionSchedule.PRONTO;

    ActionExecutionSchedule scheduleAction(ActionExecutionStartEvent event);
}
