package com.linlay.goapengine.config;

import com.linlay.goapengine.core.Agent;
import com.linlay.goapengine.core.AgentPlatform;
import com.linlay.goapengine.core.support.DefaultAgentPlatform;
import com.linlay.goapengine.event.AgenticEventListener;
import com.linlay.goapengine.event.LoggingAgenticEventListener;
import com.linlay.goapengine.spi.AgentProcessIdGenerator;
import com.linlay.goapengine.spi.AgentProcessRepository;
import com.linlay.goapengine.spi.Asyncer;
import com.linlay.goapengine.spi.LlmOperations;
import com.linlay.goapengine.spi.OperationScheduler;
import com.linlay.goapengine.spi.ToolGroup;
import com.linlay.goapengine.spi.ToolGroupResolver;
import com.linlay.goapengine.spi.support.InMemoryAgentProcessRepository;
import com.linlay.goapengine.spi.support.ReactorAsyncer;
import com.linlay.goapengine.spi.support.RegistryToolGroupResolver;
import com.linlay.goapengine.validation.AgentStructureValidator;
import com.linlay.goapengine.validation.AgentValidationManager;
import com.linlay.goapengine.validation.AgentValidator;
import com.linlay.goapengine.validation.GoapPathToCompletionValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the platform and its default ports. Every port bean can be replaced by the application.
 */
@Configuration
public class AgentPlatformConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AgentPlatformConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public AgentProcessRepository agentProcessRepository(AgentPlatformProperties properties) {
        return new InMemoryAgentProcessRepository(properties.getProcessRepository().getWindowSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public Asyncer asyncer() {
        return new ReactorAsyncer();
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.platform", name = "log-events", havingValue = "true", matchIfMissing = true)
    public LoggingAgenticEventListener loggingAgenticEventListener() {
        return new LoggingAgenticEventListener();
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolGroupResolver toolGroupResolver(AgentPlatformProperties properties, ObjectProvider<ToolGroup> toolGroups) {
        return new RegistryToolGroupResolver(properties.getName(), toolGroups.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public LlmOperations llmOperations() {
        return LlmOperations.UNAVAILABLE;
    }

    @Bean
    @ConditionalOnMissingBean
    public OperationScheduler operationScheduler() {
        return OperationScheduler.PRONTO;
    }

    @Bean
    @ConditionalOnMissingBean
    public AgentProcessIdGenerator agentProcessIdGenerator() {
        return AgentProcessIdGenerator.RANDOM;
    }

    @Bean
    public AgentStructureValidator agentStructureValidator() {
        return new AgentStructureValidator();
    }

    @Bean
    public GoapPathToCompletionValidator goapPathToCompletionValidator() {
        return new GoapPathToCompletionValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    public AgentValidationManager agentValidationManager(ObjectProvider<AgentValidator> validators) {
        return new AgentValidationManager(validators.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public AgentPlatform agentPlatform(
            AgentPlatformProperties properties,
            LlmOperations llmOperations,
            ObjectProvider<AgenticEventListener> listeners,
            ToolGroupResolver toolGroupResolver,
            Asyncer asyncer,
            OperationScheduler operationScheduler,
            AgentProcessRepository agentProcessRepository,
            AgentProcessIdGenerator agentProcessIdGenerator,
            AgentValidationManager agentValidationManager,
            ObjectProvider<Agent> agents
    ) {
        DefaultAgentPlatform platform = new DefaultAgentPlatform(
                properties.getName(),
                properties.getDescription(),
                llmOperations,
                AgenticEventListener.from(listeners.orderedStream().toList()),
                toolGroupResolver,
                asyncer,
                operationScheduler,
                agentProcessRepository,
                agentProcessIdGenerator,
                properties.defaultProcessOptions()
        );
        boolean validate = properties.getValidation().isEnabled();
        agents.orderedStream().forEach(agent -> {
            if (validate && !agentValidationManager.validate(agent).isValid()) {
                log.warn("Skip invalid agent {}", agent.name());
                return;
            }
            platform.deploy(agent);
        });
        log.info("Agent platform {} ready with {} agent(s)", platform.name(), platform.agents().size());
        return platform;
    }
}
