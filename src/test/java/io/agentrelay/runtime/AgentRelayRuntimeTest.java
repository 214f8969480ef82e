package io.agentrelay.runtime;

import io.agentrelay.config.AgentRelayConfig;
import io.agentrelay.model.Message;
import io.agentrelay.model.Response;
import io.agentrelay.model.ResponseStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

final class AgentRelayRuntimeTest {

    @Test
    void registersConfiguredWorkflowsAndSkipsInvalidOnes() {
        AgentRelayConfig config = config(List.of(
                new AgentRelayConfig.WorkflowSpec("triage", List.of(
                        new AgentRelayConfig.StepSpec("collect", "collector", null),
                        new AgentRelayConfig.StepSpec("rank", "ranker", "original_with_previous")
                )),
                new AgentRelayConfig.WorkflowSpec("broken", List.of(
                        new AgentRelayConfig.StepSpec("only", "collector", "sideways")
                )),
                new AgentRelayConfig.WorkflowSpec("empty", List.of())
        ), List.of());

        try (AgentRelayRuntime runtime = new AgentRelayRuntime(config)) {
            Assertions.assertTrue(runtime.workflowCatalog().contains("triage"));
            Assertions.assertFalse(runtime.workflowCatalog().contains("broken"));
            Assertions.assertFalse(runtime.workflowCatalog().contains("empty"));
            Assertions.assertTrue(runtime.agentRegistry().contains("echo"));
            Assertions.assertTrue(runtime.agentRegistry().contains("fail"));
        }
    }

    @Test
    void bindsEchoAgentsToUnboundTargetsOnly() {
        AgentRelayConfig config = config(List.of(
                new AgentRelayConfig.WorkflowSpec("triage", List.of(
                        new AgentRelayConfig.StepSpec("collect", "collector", null)
                ))
        ), List.of());

        try (AgentRelayRuntime runtime = new AgentRelayRuntime(config)) {
            List<String> bound = runtime.bindEchoAgentsToUnboundTargets();

            Assertions.assertTrue(bound.contains("project_plan_agent"));
            Assertions.assertTrue(bound.contains("roadmapping_agent"));
            Assertions.assertTrue(bound.contains("collector"));
            Assertions.assertFalse(bound.contains("echo"));
            Assertions.assertEquals(List.of(), runtime.bindEchoAgentsToUnboundTargets());
        }
    }

    @Test
    void runsWorkflowEndToEndAndPublishesOutcome() throws Exception {
        try (AgentRelayRuntime runtime = new AgentRelayRuntime(AgentRelayConfig.defaults())) {
            runtime.bindEchoAgentsToUnboundTargets();
            List<Message> outcomes = Collections.synchronizedList(new ArrayList<>());
            CountDownLatch received = new CountDownLatch(1);
            runtime.broker().subscribe(Orchestrator.TOPIC_COMPLETED, m -> {
                outcomes.add(m);
                received.countDown();
            });
            runtime.start();

            Response response = runtime.processAsync(Message.of("project_initialization", Map.of("project", "apollo")), 5.0);

            Assertions.assertEquals(ResponseStatus.SUCCESS, response.status());
            Assertions.assertTrue(received.await(5, TimeUnit.SECONDS));
            Assertions.assertEquals(3, outcomes.get(0).data().get("total_steps_completed"));
            String metrics = runtime.metricsText();
            Assertions.assertTrue(metrics.contains("agentrelay_workflow_runs_total{outcome=\"completed\"} 1\n"), metrics);
            Assertions.assertTrue(metrics.contains("agentrelay_broker_running 1\n"), metrics);
        }
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void configuredScriptAgentTakesPartInWorkflows() {
        AgentRelayConfig config = config(
                List.of(new AgentRelayConfig.WorkflowSpec("scripted", List.of(
                        new AgentRelayConfig.StepSpec("score", "scorer", null)
                ))),
                List.of(
                        new AgentRelayConfig.ScriptAgentSpec("scorer",
                                List.of("sh", "-c", "cat > /dev/null; echo '{\"score\":7}'"), 5_000L),
                        new AgentRelayConfig.ScriptAgentSpec("no-command", List.of(), null)
                )
        );

        try (AgentRelayRuntime runtime = new AgentRelayRuntime(config)) {
            Response response = runtime.process(Message.of("scripted", Map.of()));

            Assertions.assertEquals(ResponseStatus.SUCCESS, response.status());
            Assertions.assertFalse(runtime.agentRegistry().contains("no-command"));
            Assertions.assertTrue(runtime.agentRegistry().contains("scorer"));
        }
    }

    private static AgentRelayConfig config(
            List<AgentRelayConfig.WorkflowSpec> workflows,
            List<AgentRelayConfig.ScriptAgentSpec> scriptAgents
    ) {
        return new AgentRelayConfig(
                AgentRelayConfig.DEFAULT_AGENT_ID,
                AgentRelayConfig.DEFAULT_TIMEOUT_SECONDS,
                AgentRelayConfig.DEFAULT_SHORT_TIMEOUT_WARNING_SECONDS,
                1_000L,
                false,
                64,
                1_000L,
                null,
                Map.of(),
                workflows,
                scriptAgents
        );
    }
}
