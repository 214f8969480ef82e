package io.agentrelay.observability;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

public final class OrchestratorMetrics {
    public static final String OUTCOME_COMPLETED = "completed";
    public static final String OUTCOME_FAILED = "failed";
    public static final String OUTCOME_TIMED_OUT = "timed_out";
    public static final String OUTCOME_REJECTED = "rejected";

    private final ConcurrentMap<String, AtomicLong> runsByOutcome = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AtomicLong> timeoutsByWorkflow = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AtomicLong> agentOk = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AtomicLong> agentFailed = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AtomicLong> agentDurationNanos = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AtomicLong> agentDurationCount = new ConcurrentHashMap<>();
    private final AtomicInteger concurrentRuns = new AtomicInteger(0);
    private final AtomicLong shortTimeoutWarnings = new AtomicLong(0L);
    private final AtomicLong droppedPublications = new AtomicLong(0L);

    public void runStarted() {
        concurrentRuns.incrementAndGet();
    }

    public void runFinished(String outcome) {
        concurrentRuns.decrementAndGet();
        increment(runsByOutcome, outcome);
    }

    public void runRejected() {
        increment(runsByOutcome, OUTCOME_REJECTED);
    }

    public void workflowTimedOut(String workflowType) {
        increment(timeoutsByWorkflow, workflowType);
    }

    public void agentInvoked(String agentId, boolean success, long durationNanos) {
        increment(success ? agentOk : agentFailed, agentId);
        agentDurationNanos.computeIfAbsent(agentId, ignored -> new AtomicLong(0L)).addAndGet(Math.max(0L, durationNanos));
        increment(agentDurationCount, agentId);
    }

    public void shortTimeoutWarned() {
        shortTimeoutWarnings.incrementAndGet();
    }

    public void publicationDropped() {
        droppedPublications.incrementAndGet();
    }

    public int concurrentRuns() {
        return concurrentRuns.get();
    }

    public MetricsSnapshot snapshot() {
        Map<String, Long> durations = new TreeMap<>();
        for (Map.Entry<String, AtomicLong> e : agentDurationNanos.entrySet()) {
            durations.put(e.getKey(), TimeUnit.NANOSECONDS.toMillis(e.getValue().get()));
        }
        return new MetricsSnapshot(
                copy(runsByOutcome),
                copy(timeoutsByWorkflow),
                copy(agentOk),
                copy(agentFailed),
                durations,
                copy(agentDurationCount),
                concurrentRuns.get(),
                shortTimeoutWarnings.get(),
                droppedPublications.get()
        );
    }

    private static void increment(ConcurrentMap<String, AtomicLong> counters, String key) {
        String safeKey = key == null || key.isBlank() ? "unknown" : key;
        counters.computeIfAbsent(safeKey, ignored -> new AtomicLong(0L)).incrementAndGet();
    }

    private static Map<String, Long> copy(ConcurrentMap<String, AtomicLong> counters) {
        Map<String, Long> out = new TreeMap<>();
        for (Map.Entry<String, AtomicLong> e : counters.entrySet()) {
            out.put(e.getKey(), e.getValue().get());
        }
        return out;
    }
}
