package io.agentrelay.config;

import io.agentrelay.util.Jsons;
import io.agentrelay.workflow.InputMappings;
import io.agentrelay.workflow.WorkflowDefinition;
import io.agentrelay.workflow.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Settings consumed by the broker and the orchestrator.
 *
 * <p>Values come from built-in defaults, then an optional JSON file, then {@code AGENTRELAY_*}
 * environment variables. Out-of-range values are clamped rather than rejected.
 */
public record AgentRelayConfig(
        String orchestratorAgentId,
        double defaultTimeoutSeconds,
        double shortTimeoutWarningSeconds,
        long cancelGraceMillis,
        boolean publishStepEvents,
        int brokerQueueCapacity,
        long brokerDrainTimeoutMillis,
        Path eventLogFile,
        Map<String, String> routingRules,
        List<WorkflowSpec> workflows,
        List<ScriptAgentSpec> scriptAgents
) {
    private static final Logger log = LoggerFactory.getLogger(AgentRelayConfig.class);

    public static final String DEFAULT_AGENT_ID = "orchestrator_agent";
    public static final double DEFAULT_TIMEOUT_SECONDS = 30.0;
    public static final double DEFAULT_SHORT_TIMEOUT_WARNING_SECONDS = 1.0;
    public static final long DEFAULT_CANCEL_GRACE_MS = 5_000L;
    public static final int DEFAULT_QUEUE_CAPACITY = 1_000;
    public static final long DEFAULT_DRAIN_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_SCRIPT_TIMEOUT_MS = 60_000L;

    public static final String ENV_DEFAULT_TIMEOUT = "AGENTRELAY_DEFAULT_TIMEOUT_SECONDS";
    public static final String ENV_QUEUE_CAPACITY = "AGENTRELAY_BROKER_QUEUE_CAPACITY";
    public static final String ENV_PUBLISH_STEP_EVENTS = "AGENTRELAY_PUBLISH_STEP_EVENTS";
    public static final String ENV_EVENT_LOG_FILE = "AGENTRELAY_EVENT_LOG_FILE";

    public AgentRelayConfig {
        orchestratorAgentId = orchestratorAgentId == null || orchestratorAgentId.isBlank()
                ? DEFAULT_AGENT_ID
                : orchestratorAgentId.trim();
        routingRules = routingRules == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(routingRules));
        workflows = workflows == null ? List.of() : List.copyOf(workflows);
        scriptAgents = scriptAgents == null ? List.of() : List.copyOf(scriptAgents);
    }

    public static AgentRelayConfig defaults() {
        return new AgentRelayConfig(
                DEFAULT_AGENT_ID,
                DEFAULT_TIMEOUT_SECONDS,
                DEFAULT_SHORT_TIMEOUT_WARNING_SECONDS,
                DEFAULT_CANCEL_GRACE_MS,
                false,
                DEFAULT_QUEUE_CAPACITY,
                DEFAULT_DRAIN_TIMEOUT_MS,
                null,
                Map.of(),
                List.of(),
                List.of()
        );
    }

    public static AgentRelayConfig load(String file) {
        Path path = file == null || file.isBlank() ? null : Paths.get(file);
        return load(path, System.getenv());
    }

    public static AgentRelayConfig load(Path file, Map<String, String> env) {
        AgentRelayConfig config = defaults();
        if (file != null) {
            if (!Files.exists(file)) {
                throw new IllegalArgumentException("Config file not found: " + file);
            }
            try {
                ConfigFile parsed = Jsons.mapper().readValue(file.toFile(), ConfigFile.class);
                config = fromFile(parsed, config);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load config file: " + file, e);
            }
            log.info("Loaded configuration from {}", file);
        }
        return withEnvironment(config, env == null ? Map.of() : env);
    }

    static AgentRelayConfig fromFile(ConfigFile file, AgentRelayConfig defaults) {
        if (file == null) {
            return defaults;
        }
        OrchestratorSection orchestrator = file.orchestrator() == null
                ? new OrchestratorSection(null, null, null, null, null)
                : file.orchestrator();
        BrokerSection broker = file.broker() == null ? new BrokerSection(null, null) : file.broker();
        Map<String, String> rules = new LinkedHashMap<>(defaults.routingRules());
        if (file.routingRules() != null) {
            rules.putAll(file.routingRules());
        }
        return new AgentRelayConfig(
                orchestrator.agentId() == null ? defaults.orchestratorAgentId() : orchestrator.agentId(),
                sanitizeDouble(orchestrator.defaultTimeoutSeconds(), defaults.defaultTimeoutSeconds(), 0.0),
                sanitizeDouble(orchestrator.shortTimeoutWarningSeconds(), defaults.shortTimeoutWarningSeconds(), 0.0),
                sanitizeLong(orchestrator.cancelGraceMillis(), defaults.cancelGraceMillis(), 1L),
                sanitizeBoolean(orchestrator.publishStepEvents(), defaults.publishStepEvents()),
                sanitizeInt(broker.queueCapacity(), defaults.brokerQueueCapacity(), 1),
                sanitizeLong(broker.drainTimeoutMillis(), defaults.brokerDrainTimeoutMillis(), 1L),
                file.eventLogFile() == null || file.eventLogFile().isBlank()
                        ? defaults.eventLogFile()
                        : Paths.get(file.eventLogFile().trim()),
                rules,
                file.workflows() == null ? defaults.workflows() : file.workflows(),
                file.scriptAgents() == null ? defaults.scriptAgents() : file.scriptAgents()
        );
    }

    static AgentRelayConfig withEnvironment(AgentRelayConfig base, Map<String, String> env) {
        AgentRelayConfig out = base;
        String timeout = env.get(ENV_DEFAULT_TIMEOUT);
        if (timeout != null && !timeout.isBlank()) {
            try {
                out = out.withDefaultTimeoutSeconds(sanitizeDouble(Double.parseDouble(timeout.trim()), out.defaultTimeoutSeconds(), 0.0));
            } catch (NumberFormatException e) {
                log.warn("Ignoring {}={}: not a number", ENV_DEFAULT_TIMEOUT, timeout);
            }
        }
        String capacity = env.get(ENV_QUEUE_CAPACITY);
        if (capacity != null && !capacity.isBlank()) {
            try {
                out = out.withBrokerQueueCapacity(Integer.parseInt(capacity.trim()));
            } catch (NumberFormatException e) {
                log.warn("Ignoring {}={}: not an integer", ENV_QUEUE_CAPACITY, capacity);
            }
        }
        String publishSteps = env.get(ENV_PUBLISH_STEP_EVENTS);
        if (publishSteps != null && !publishSteps.isBlank()) {
            out = out.withPublishStepEvents("true".equals(publishSteps.trim().toLowerCase(Locale.ROOT)));
        }
        String eventLog = env.get(ENV_EVENT_LOG_FILE);
        if (eventLog != null && !eventLog.isBlank()) {
            out = out.withEventLogFile(Paths.get(eventLog.trim()));
        }
        return out;
    }

    public AgentRelayConfig withDefaultTimeoutSeconds(double seconds) {
        return new AgentRelayConfig(orchestratorAgentId, sanitizeDouble(seconds, defaultTimeoutSeconds, 0.0),
                shortTimeoutWarningSeconds, cancelGraceMillis, publishStepEvents, brokerQueueCapacity,
                brokerDrainTimeoutMillis, eventLogFile, routingRules, workflows, scriptAgents);
    }

    public AgentRelayConfig withCancelGraceMillis(long millis) {
        return new AgentRelayConfig(orchestratorAgentId, defaultTimeoutSeconds, shortTimeoutWarningSeconds,
                Math.max(1L, millis), publishStepEvents, brokerQueueCapacity, brokerDrainTimeoutMillis,
                eventLogFile, routingRules, workflows, scriptAgents);
    }

    public AgentRelayConfig withPublishStepEvents(boolean enabled) {
        return new AgentRelayConfig(orchestratorAgentId, defaultTimeoutSeconds, shortTimeoutWarningSeconds,
                cancelGraceMillis, enabled, brokerQueueCapacity, brokerDrainTimeoutMillis, eventLogFile,
                routingRules, workflows, scriptAgents);
    }

    public AgentRelayConfig withBrokerQueueCapacity(int capacity) {
        return new AgentRelayConfig(orchestratorAgentId, defaultTimeoutSeconds, shortTimeoutWarningSeconds,
                cancelGraceMillis, publishStepEvents, Math.max(1, capacity), brokerDrainTimeoutMillis,
                eventLogFile, routingRules, workflows, scriptAgents);
    }

    public AgentRelayConfig withEventLogFile(Path file) {
        return new AgentRelayConfig(orchestratorAgentId, defaultTimeoutSeconds, shortTimeoutWarningSeconds,
                cancelGraceMillis, publishStepEvents, brokerQueueCapacity, brokerDrainTimeoutMillis, file,
                routingRules, workflows, scriptAgents);
    }

    public List<WorkflowDefinition> workflowDefinitions() {
        List<WorkflowDefinition> out = new ArrayList<>();
        for (WorkflowSpec spec : workflows) {
            out.add(spec.toDefinition());
        }
        return out;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static double sanitizeDouble(Double raw, double fallback, double min) {
        if (raw == null || raw.isNaN() || raw.isInfinite()) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }

    public record WorkflowSpec(String type, List<StepSpec> steps) {
        public WorkflowDefinition toDefinition() {
            if (steps == null || steps.isEmpty()) {
                throw new IllegalArgumentException("Workflow must contain at least one step: " + type);
            }
            List<WorkflowStep> built = new ArrayList<>();
            for (StepSpec step : steps) {
                if (step == null) {
                    throw new IllegalArgumentException("Workflow step cannot be null: " + type);
                }
                built.add(new WorkflowStep(step.name(), step.agent(), InputMappings.byName(step.input())));
            }
            return new WorkflowDefinition(type, built);
        }
    }

    public record StepSpec(String name, String agent, String input) {
    }

    public record ScriptAgentSpec(String id, List<String> command, Long timeoutMs) {
        public long resolvedTimeoutMs() {
            return timeoutMs == null ? DEFAULT_SCRIPT_TIMEOUT_MS : timeoutMs;
        }
    }

    record ConfigFile(
            OrchestratorSection orchestrator,
            BrokerSection broker,
            String eventLogFile,
            Map<String, String> routingRules,
            List<WorkflowSpec> workflows,
            List<ScriptAgentSpec> scriptAgents
    ) {
    }

    record OrchestratorSection(
            String agentId,
            Double defaultTimeoutSeconds,
            Double shortTimeoutWarningSeconds,
            Long cancelGraceMillis,
            Boolean publishStepEvents
    ) {
    }

    record BrokerSection(Integer queueCapacity, Long drainTimeoutMillis) {
    }
}
