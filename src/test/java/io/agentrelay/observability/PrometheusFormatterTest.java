package io.agentrelay.observability;

import io.agentrelay.broker.BrokerStats;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

final class PrometheusFormatterTest {

    @Test
    void rendersOrchestratorAndBrokerMetrics() {
        OrchestratorMetrics metrics = new OrchestratorMetrics();
        metrics.runStarted();
        metrics.runFinished(OrchestratorMetrics.OUTCOME_COMPLETED);
        metrics.runStarted();
        metrics.runFinished(OrchestratorMetrics.OUTCOME_TIMED_OUT);
        metrics.workflowTimedOut("project_initialization");
        metrics.agentInvoked("project_plan_agent", true, TimeUnit.MILLISECONDS.toNanos(12));
        metrics.agentInvoked("project_plan_agent", false, TimeUnit.MILLISECONDS.toNanos(3));
        metrics.runStarted();
        BrokerStats broker = new BrokerStats(true, 2, 1000, 3, 4, 10L, 8L, 1L, 0L, 0L);

        String text = PrometheusFormatter.format(metrics.snapshot(), broker);

        Assertions.assertTrue(text.contains("agentrelay_workflow_runs_total{outcome=\"completed\"} 1\n"), text);
        Assertions.assertTrue(text.contains("agentrelay_workflow_runs_total{outcome=\"timed_out\"} 1\n"), text);
        Assertions.assertTrue(text.contains("agentrelay_workflow_timeouts_total{workflow_type=\"project_initialization\"} 1\n"), text);
        Assertions.assertTrue(text.contains("agentrelay_agent_invocations_total{agent=\"project_plan_agent\",success=\"true\"} 1\n"), text);
        Assertions.assertTrue(text.contains("agentrelay_agent_invocations_total{agent=\"project_plan_agent\",success=\"false\"} 1\n"), text);
        Assertions.assertTrue(text.contains("agentrelay_agent_duration_ms_sum{agent=\"project_plan_agent\"} 15\n"), text);
        Assertions.assertTrue(text.contains("agentrelay_agent_duration_ms_count{agent=\"project_plan_agent\"} 2\n"), text);
        Assertions.assertTrue(text.contains("agentrelay_concurrent_runs 1\n"), text);
        Assertions.assertTrue(text.contains("agentrelay_broker_queue_depth 2\n"), text);
        Assertions.assertTrue(text.contains("agentrelay_broker_subscriber_failures_total 1\n"), text);
        Assertions.assertEquals(1, countOccurrences(text, "# HELP agentrelay_agent_invocations_total "));
    }

    @Test
    void escapesLabelValues() {
        OrchestratorMetrics metrics = new OrchestratorMetrics();
        metrics.workflowTimedOut("odd\"type");

        String text = PrometheusFormatter.format(metrics.snapshot(), null);

        Assertions.assertTrue(text.contains("workflow_type=\"odd\\\"type\""), text);
        Assertions.assertFalse(text.contains("agentrelay_broker_running"));
    }

    private static int countOccurrences(String text, String needle) {
        int count = 0;
        int idx = text.indexOf(needle);
        while (idx >= 0) {
            count++;
            idx = text.indexOf(needle, idx + needle.length());
        }
        return count;
    }
}
