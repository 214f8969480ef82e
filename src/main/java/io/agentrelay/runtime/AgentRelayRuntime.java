package io.agentrelay.runtime;

import io.agentrelay.agent.Agent;
import io.agentrelay.agent.AgentRegistry;
import io.agentrelay.agent.EchoAgent;
import io.agentrelay.agent.FailAgent;
import io.agentrelay.agent.ScriptAgent;
import io.agentrelay.broker.MessageBroker;
import io.agentrelay.config.AgentRelayConfig;
import io.agentrelay.model.Message;
import io.agentrelay.model.Response;
import io.agentrelay.observability.OrchestratorMetrics;
import io.agentrelay.observability.PrometheusFormatter;
import io.agentrelay.observability.WorkflowEventLogger;
import io.agentrelay.workflow.WorkflowCatalog;
import io.agentrelay.workflow.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Wires broker, agent registry, workflow catalogue and orchestrator from one {@link AgentRelayConfig}.
 */
public final class AgentRelayRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AgentRelayRuntime.class);

    private final AgentRelayConfig config;
    private final MessageBroker broker;
    private final AgentRegistry agentRegistry;
    private final WorkflowCatalog workflowCatalog;
    private final OrchestratorMetrics metrics;
    private final Orchestrator orchestrator;

    public AgentRelayRuntime(AgentRelayConfig config) {
        this.config = config == null ? AgentRelayConfig.defaults() : config;
        this.broker = new MessageBroker(
                "agentrelay-broker",
                this.config.brokerQueueCapacity(),
                this.config.brokerDrainTimeoutMillis(),
                null
        );
        this.agentRegistry = new AgentRegistry();
        this.workflowCatalog = WorkflowCatalog.withDefaults();
        this.metrics = new OrchestratorMetrics();
        this.orchestrator = new Orchestrator(
                this.config,
                agentRegistry,
                workflowCatalog,
                broker,
                new WorkflowEventLogger(this.config.eventLogFile()),
                metrics
        );
        registerDefaultAgents();
        registerConfiguredScriptAgents();
        registerConfiguredWorkflows();
    }

    public void start() {
        broker.start();
    }

    @Override
    public void close() {
        orchestrator.close();
        broker.stop();
    }

    public Response process(Message message) {
        return orchestrator.process(message);
    }

    public Response processAsync(Message message, double timeoutSeconds) {
        return orchestrator.processAsync(message, timeoutSeconds);
    }

    public void registerAgent(Agent agent) {
        orchestrator.registerAgent(agent);
    }

    /**
     * Binds an {@link EchoAgent} to every routing target and workflow step agent that has no
     * registered agent yet.
     *
     * @return the ids that were bound
     */
    public List<String> bindEchoAgentsToUnboundTargets() {
        Set<String> targets = new LinkedHashSet<>(orchestrator.routingRules().values());
        for (WorkflowDefinition definition : workflowCatalog.list()) {
            definition.steps().forEach(step -> targets.add(step.agentId()));
        }
        List<String> bound = targets.stream().filter(id -> !agentRegistry.contains(id)).toList();
        for (String id : bound) {
            agentRegistry.register(new EchoAgent(id));
        }
        return bound;
    }

    public String metricsText() {
        return PrometheusFormatter.format(metrics.snapshot(), broker.stats());
    }

    public AgentRelayConfig config() {
        return config;
    }

    public MessageBroker broker() {
        return broker;
    }

    public AgentRegistry agentRegistry() {
        return agentRegistry;
    }

    public WorkflowCatalog workflowCatalog() {
        return workflowCatalog;
    }

    public Orchestrator orchestrator() {
        return orchestrator;
    }

    private void registerDefaultAgents() {
        agentRegistry.register(new EchoAgent());
        agentRegistry.register(new FailAgent());
    }

    private void registerConfiguredScriptAgents() {
        if (config.scriptAgents().isEmpty()) {
            return;
        }
        int loaded = 0;
        int skipped = 0;
        for (AgentRelayConfig.ScriptAgentSpec spec : config.scriptAgents()) {
            if (spec == null || spec.id() == null || spec.id().isBlank() || spec.command() == null || spec.command().isEmpty()) {
                skipped++;
                continue;
            }
            try {
                agentRegistry.register(new ScriptAgent(spec.id(), spec.command(), spec.resolvedTimeoutMs()));
                loaded++;
            } catch (IllegalArgumentException e) {
                skipped++;
                log.warn("Skipping script agent {}: {}", spec.id(), e.getMessage());
            }
        }
        log.info("Script agents loaded={} skipped={}", loaded, skipped);
    }

    private void registerConfiguredWorkflows() {
        for (AgentRelayConfig.WorkflowSpec spec : config.workflows()) {
            if (spec == null) {
                continue;
            }
            try {
                orchestrator.registerWorkflow(spec.toDefinition());
            } catch (IllegalArgumentException e) {
                log.warn("Skipping workflow {}: {}", spec.type(), e.getMessage());
            }
        }
    }
}
