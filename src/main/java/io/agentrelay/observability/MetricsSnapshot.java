package io.agentrelay.observability;

import java.util.Map;

public record MetricsSnapshot(
        Map<String, Long> runsByOutcome,
        Map<String, Long> timeoutsByWorkflow,
        Map<String, Long> agentInvocationsOk,
        Map<String, Long> agentInvocationsFailed,
        Map<String, Long> agentDurationMillisSum,
        Map<String, Long> agentDurationCount,
        int concurrentRuns,
        long shortTimeoutWarnings,
        long droppedPublications
) {
}
