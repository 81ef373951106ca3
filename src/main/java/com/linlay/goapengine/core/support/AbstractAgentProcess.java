package com.linlay.goapengine.core.support;

import com.linlay.goapengine.core.Action;
import com.linlay.goapengine.core.ActionInvocation;
import com.linlay.goapengine.core.ActionStatus;
import com.linlay.goapengine.core.ActionStatusCode;
import com.linlay.goapengine.core.Agent;
import com.linlay.goapengine.core.AgentProcess;
import com.linlay.goapengine.core.AgentProcessStatusCode;
import com.linlay.goapengine.core.Blackboard;
import com.linlay.goapengine.core.Goal;
import com.linlay.goapengine.core.IoBinding;
import com.linlay.goapengine.core.LlmInvocation;
import com.linlay.goapengine.core.ProcessContext;
import com.linlay.goapengine.core.ProcessOptions;
import com.linlay.goapengine.core.SchemaType;
import com.linlay.goapengine.core.policy.EarlyTermination;
import com.linlay.goapengine.core.policy.EarlyTerminationPolicy;
import com.linlay.goapengine.event.ActionExecutionStartEvent;
import com.linlay.goapengine.event.AgentProcessFinishedEvent;
import com.linlay.goapengine.event.AgentProcessPausedEvent;
import com.linlay.goapengine.event.AgentProcessStuckEvent;
import com.linlay.goapengine.event.AgentProcessWaitingEvent;
import com.linlay.goapengine.event.ObjectAddedEvent;
import com.linlay.goapengine.event.ObjectBoundEvent;
import com.linlay.goapengine.event.ProcessKilledEvent;
import com.linlay.goapengine.plan.WorldState;
import com.linlay.goapengine.spi.ActionExecutionSchedule;
import com.linlay.goapengine.spi.PlatformServices;
import com.linlay.goapengine.spi.StuckHandler;
import com.linlay.goapengine.spi.StuckHandlerResult;
import com.linlay.goapengine.spi.StuckHandlingResultCode;
import com.linlay.goapengine.spi.ToolGroupResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The run loop, status transitions, action execution and event emission shared by
 * agent processes. Subclasses decide how a single tick plans.
 */
public abstract class AbstractAgentProcess implements AgentProcess {

    private static final Logger log = LoggerFactory.getLogger(AbstractAgentProcess.class);

    private final String id;
    private final String parentId;
    private final Agent agent;
    private final ProcessOptions processOptions;
    private final Blackboard blackboard;
    private final PlatformServices platformServices;
    private final ProcessContext processContext;
    private final Instant timestamp;

    private final AtomicReference<AgentProcessStatusCode> status =
            new AtomicReference<>(AgentProcessStatusCode.NOT_STARTED);
    private final List<ActionInvocation> history = new CopyOnWriteArrayList<>();
    private final List<LlmInvocation> llmInvocations = new CopyOnWriteArrayList<>();
    private volatile WorldState lastWorldState;
    private volatile Object failureInfo;
    private volatile Goal goal;

    protected AbstractAgentProcess(
            String id,
            String parentId,
            Agent agent,
            ProcessOptions processOptions,
            Blackboard blackboard,
            PlatformServices platformServices
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.parentId = parentId;
        this.agent = Objects.requireNonNull(agent, "agent");
        this.processOptions = processOptions == null ? ProcessOptions.DEFAULT : processOptions;
        this.blackboard = Objects.requireNonNull(blackboard, "blackboard");
        this.platformServices = Objects.requireNonNull(platformServices, "platformServices");
        this.processContext = new ProcessContext(platformServices, this, this.processOptions);
        this.timestamp = Instant.now();
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String parentId() {
        return parentId;
    }

    @Override
    public Agent agent() {
        return agent;
    }

    @Override
    public ProcessOptions processOptions() {
        return processOptions;
    }

    @Override
    public Blackboard blackboard() {
        return blackboard;
    }

    @Override
    public ProcessContext processContext() {
        return processContext;
    }

    protected PlatformServices platformServices() {
        return platformServices;
    }

    @Override
    public AgentProcessStatusCode status() {
        return status.get();
    }

    @Override
    public List<ActionInvocation> history() {
        return Collections.unmodifiableList(history);
    }

    @Override
    public WorldState lastWorldState() {
        return lastWorldState;
    }

    protected void setLastWorldState(WorldState worldState) {
        this.lastWorldState = worldState;
    }

    @Override
    public Object failureInfo() {
        return failureInfo;
    }

    @Override
    public Goal goal() {
        return goal;
    }

    /**
     * Commits the process to a goal.
     *
     * @throws IllegalStateException when a different goal is already committed and goal change is not allowed
     */
    protected void commitToGoal(Goal next) {
        Goal current = this.goal;
        if (current != null && !current.name().equals(next.name()) && !processOptions.allowGoalChange()) {
            throw new IllegalStateException("Process " + id + " may not change goal from "
                    + current.name() + " to " + next.name());
        }
        if (current == null || !current.name().equals(next.name())) {
            log.debug("Process {} committed to goal {}", id, next.name());
        }
        this.goal = next;
    }

    @Override
    public Instant timestamp() {
        return timestamp;
    }

    @Override
    public Duration runningTime() {
        return Duration.between(timestamp, Instant.now());
    }

    @Override
    public List<LlmInvocation> llmInvocations() {
        return Collections.unmodifiableList(llmInvocations);
    }

    @Override
    public void recordLlmInvocation(LlmInvocation invocation) {
        llmInvocations.add(invocation);
    }

    @Override
    public AgentProcess bind(String name, Object value) {
        blackboard.bind(name, value);
        processContext.onProcessEvent(new ObjectBoundEvent(this, name, value));
        return this;
    }

    @Override
    public AgentProcess addObject(Object value) {
        blackboard.addObject(value);
        processContext.onProcessEvent(new ObjectAddedEvent(this, value));
        return this;
    }

    /**
     * Sets the status unless the process has been killed in the meantime.
     */
    protected void setStatus(AgentProcessStatusCode next) {
        status.updateAndGet(current -> current == AgentProcessStatusCode.KILLED ? current : next);
    }

    @Override
    public AgentProcess run() {
        if (agent.goals().isEmpty()) {
            throw new IllegalStateException("Agent " + agent.name() + " has no goals: cannot run process " + id);
        }
        AgentProcessStatusCode current = status.get();
        if (current.isTerminal()) {
            log.warn("Process {} is already {}: ignoring run", id, current);
            return this;
        }
        if (current == AgentProcessStatusCode.RUNNING
                || !status.compareAndSet(current, AgentProcessStatusCode.RUNNING)) {
            log.debug("Process {} is already running", id);
            return this;
        }
        log.info("Running process {} of agent {}", id, agent.name());

        boolean replan;
        do {
            try {
                runLoop();
            } catch (RuntimeException ex) {
                failureInfo = ex;
                setStatus(AgentProcessStatusCode.FAILED);
                log.warn("Process {} failed: {}", id, ex.getMessage());
                processContext.onProcessEvent(new AgentProcessFinishedEvent(this));
                throw ex;
            }
            replan = afterLoop();
        } while (replan);
        return this;
    }

    private void runLoop() {
        EarlyTerminationPolicy policy = processOptions.control().earlyTerminationPolicy();
        while (status.get() == AgentProcessStatusCode.RUNNING) {
            EarlyTermination termination = policy.shouldTerminate(this);
            if (termination != null) {
                failureInfo = termination;
                setStatus(AgentProcessStatusCode.TERMINATED);
                log.info("Process {} terminated by {}: {}", id, termination.getPolicy().name(), termination.getReason());
                processContext.onProcessEvent(termination);
                return;
            }
            tick();
        }
    }

    /**
     * Emits the event for the status the loop ended in.
     *
     * @return true when a stuck handler asked to plan again
     */
    private boolean afterLoop() {
        AgentProcessStatusCode ended = status.get();
        switch (ended) {
            case COMPLETED, FAILED -> {
                log.info("Process {} finished with status {}", id, ended);
                processContext.onProcessEvent(new AgentProcessFinishedEvent(this));
                return false;
            }
            case WAITING -> {
                processContext.onProcessEvent(new AgentProcessWaitingEvent(this));
                return false;
            }
            case STUCK -> {
                processContext.onProcessEvent(new AgentProcessStuckEvent(this));
                return handleStuck(ended);
            }
            case PAUSED -> {
                processContext.onProcessEvent(new AgentProcessPausedEvent(this));
                return handleStuck(ended);
            }
            default -> {
                return false;
            }
        }
    }

    private boolean handleStuck(AgentProcessStatusCode stuckStatus) {
        StuckHandler stuckHandler = agent.stuckHandler();
        if (stuckHandler == null) {
            log.warn("Process {} is {} and agent {} has no stuck handler", id, stuckStatus, agent.name());
            return false;
        }
        StuckHandlerResult result = stuckHandler.handleStuck(this);
        processContext.onProcessEvent(result);
        if (result.getCode() == StuckHandlingResultCode.REPLAN) {
            log.info("Stuck handler for process {} asked to replan: {}", id, result.getMessage());
            return status.compareAndSet(stuckStatus, AgentProcessStatusCode.RUNNING);
        }
        log.warn("Stuck handler for process {} found no resolution: {}", id, result.getMessage());
        return false;
    }

    @Override
    public ProcessKilledEvent kill() {
        AgentProcessStatusCode previous = status.getAndUpdate(
                current -> current.isTerminal() ? current : AgentProcessStatusCode.KILLED);
        if (previous.isTerminal()) {
            log.debug("Process {} already {}: nothing to kill", id, previous);
            return null;
        }
        log.info("Killed process {}", id);
        ProcessKilledEvent event = new ProcessKilledEvent(this);
        processContext.onProcessEvent(event);
        return event;
    }

    /**
     * Runs one action under its retry policy, recording the invocation and emitting start and
     * result events. Failures after the last attempt become the process failure info.
     */
    protected ActionStatus executeAction(Action action) {
        Map<String, SchemaType> outputTypes = new LinkedHashMap<>();
        for (IoBinding output : action.outputs()) {
            outputTypes.put(output.type(), agent.resolveSchemaType(output.type()));
        }
        checkToolGroups(action);

        ActionExecutionStartEvent startEvent = new ActionExecutionStartEvent(this, action);
        processContext.onProcessEvent(startEvent);

        ActionExecutionSchedule schedule = platformServices.operationScheduler().scheduleAction(startEvent);
        if (schedule instanceof ActionExecutionSchedule.Scheduled scheduled) {
            log.info("Action {} of process {} scheduled for {}: pausing", action.name(), id, scheduled.at());
            ActionStatus paused = new ActionStatus(Duration.ZERO, ActionStatusCode.PAUSED);
            processContext.onProcessEvent(startEvent.resultEvent(paused));
            return paused;
        }
        if (schedule instanceof ActionExecutionSchedule.Delayed delayed) {
            pause(delayed.delay());
        }
        pause(processOptions.control().operationDelay().duration());

        Instant start = Instant.now();
        RetryCallback<ActionStatus, RuntimeException> callback = context -> {
            if (context.getRetryCount() > 0) {
                log.info("Retrying action {} of process {}: attempt {}", action.name(), id, context.getRetryCount() + 1);
            }
            return action.execute(processContext, outputTypes);
        };
        ActionStatus actionStatus;
        try {
            actionStatus = action.qos().retryTemplate().execute(callback);
        } catch (RuntimeException ex) {
            failureInfo = ex;
            log.warn("Action {} of process {} failed after retries: {}", action.name(), id, ex.getMessage());
            actionStatus = new ActionStatus(Duration.between(start, Instant.now()), ActionStatusCode.FAILED);
        }
        history.add(new ActionInvocation(action.name(), start, Duration.between(start, Instant.now())));
        processContext.onProcessEvent(startEvent.resultEvent(actionStatus));
        return actionStatus;
    }

    private void checkToolGroups(Action action) {
        ToolGroupResolver resolver = platformServices.toolGroupResolver();
        if (resolver == null) {
            return;
        }
        for (String role : action.toolGroups()) {
            if (resolver.resolveToolGroup(role).isEmpty()) {
                log.warn("Action {} asks for tool group '{}' which is not available", action.name(), role);
            }
        }
    }

    private void pause(Duration duration) {
        if (duration.isZero()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Process {} interrupted while delaying an action", id);
        }
    }

    @Override
    public String toString() {
        return infoString(false);
    }
}
