package io.agentrelay.observability;

import io.agentrelay.broker.BrokerStats;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(MetricsSnapshot metrics, BrokerStats broker) {
        StringBuilder sb = new StringBuilder();
        if (metrics != null) {
            appendMapCounter(sb, "agentrelay_workflow_runs_total", "Workflow runs grouped by outcome", "outcome", metrics.runsByOutcome());
            appendMapCounter(sb, "agentrelay_workflow_timeouts_total", "Deadline expiries grouped by workflow type", "workflow_type", metrics.timeoutsByWorkflow());
            appendMapCounter(sb, "agentrelay_agent_invocations_total", "Agent invocations grouped by agent", "agent", "success", "true", metrics.agentInvocationsOk());
            appendMapCounter(sb, "agentrelay_agent_invocations_total", "Agent invocations grouped by agent", "agent", "success", "false", metrics.agentInvocationsFailed());
            appendMapCounter(sb, "agentrelay_agent_duration_ms_sum", "Total agent processing time in milliseconds", "agent", metrics.agentDurationMillisSum());
            appendMapCounter(sb, "agentrelay_agent_duration_ms_count", "Agent invocations included in the duration sum", "agent", metrics.agentDurationCount());
            appendGauge(sb, "agentrelay_concurrent_runs", "Workflow runs currently executing", metrics.concurrentRuns());
            appendCounter(sb, "agentrelay_short_timeout_warnings_total", "Async runs started with a timeout under the warning threshold", metrics.shortTimeoutWarnings());
            appendCounter(sb, "agentrelay_outcome_publications_dropped_total", "Outcome events the broker refused", metrics.droppedPublications());
        }
        if (broker != null) {
            appendGauge(sb, "agentrelay_broker_running", "Broker worker state (1=running,0=stopped)", broker.running() ? 1 : 0);
            appendGauge(sb, "agentrelay_broker_queue_depth", "Messages waiting for delivery", broker.queueDepth());
            appendGauge(sb, "agentrelay_broker_queue_capacity", "Configured broker queue capacity", broker.queueCapacity());
            appendGauge(sb, "agentrelay_broker_subscriptions", "Active subscriptions", broker.subscriptions());
            appendCounter(sb, "agentrelay_broker_published_total", "Messages accepted by publish", broker.published());
            appendCounter(sb, "agentrelay_broker_delivered_total", "Successful subscriber invocations", broker.delivered());
            appendCounter(sb, "agentrelay_broker_subscriber_failures_total", "Subscriber callbacks that threw", broker.subscriberFailures());
            appendCounter(sb, "agentrelay_broker_saturated_total", "Publishes rejected because the queue was full", broker.saturatedRejections());
            appendCounter(sb, "agentrelay_broker_worker_restarts_total", "Broker worker restarts after a crash", broker.workerRestarts());
        }
        return sb.toString();
    }

    private static void appendMapCounter(StringBuilder sb, String metric, String help, String label, Map<String, Long> values) {
        appendMapCounter(sb, metric, help, label, null, null, values);
    }

    private static void appendMapCounter(
            StringBuilder sb,
            String metric,
            String help,
            String label,
            String extraLabel,
            String extraValue,
            Map<String, Long> values
    ) {
        appendHeader(sb, metric, help, "counter");
        for (Map.Entry<String, Long> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append('"');
            if (extraLabel != null && extraValue != null) {
                sb.append(',').append(extraLabel).append("=\"").append(escapeLabel(extraValue)).append('"');
            }
            sb.append('}').append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendCounter(StringBuilder sb, String metric, String help, long value) {
        appendHeader(sb, metric, help, "counter");
        sb.append(metric).append(' ').append(value).append('\n');
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, long value) {
        appendHeader(sb, metric, help, "gauge");
        sb.append(metric).append(' ').append(value).append('\n');
    }

    private static void appendHeader(StringBuilder sb, String metric, String help, String type) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(' ').append(type).append('\n');
        }
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
