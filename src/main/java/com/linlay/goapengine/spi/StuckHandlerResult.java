package com.linlay.goapengine.spi;

import com.linlay.goapengine.core.AgentProcess;
import com.linlay.goapengine.event.AbstractAgentProcessEvent;

public class StuckHandlerResult extends AbstractAgentProcessEvent {

    private final String message;
    private final StuckHandlingResultCode code;

    public StuckHandlerResult(AgentProcess agentProcess, String message, StuckHandlingResultCode code) {
        super(agentProcess);
        this.message = message;
        this.code = code == null ? StuckHandlingResultCode.NO_RESOLUTION : code;
    }

    public String getMessage() {
        return message;
    }

    public StuckHandlingResultCode getCode() {
        return code;
    }
}
