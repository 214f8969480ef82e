package io.agentrelay.workflow;

import io.agentrelay.model.StepRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only record of one workflow run. Written by the thread executing the steps and read by
 * the caller after the run ends or is cancelled; never shared between runs.
 *
 * <p>Once {@link #seal()} is called the ledger refuses further entries.
 */
public final class WorkflowLedger {
    private final List<StepRecord> entries = new ArrayList<>();
    private boolean sealed;

    /**
     * @return {@code false} when the ledger was already sealed and the entry was dropped
     */
    public synchronized boolean append(StepRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("ledger entry cannot be null");
        }
        if (sealed) {
            return false;
        }
        entries.add(record);
        return true;
    }

    public synchronized List<StepRecord> seal() {
        sealed = true;
        return List.copyOf(entries);
    }

    public synchronized boolean isSealed() {
        return sealed;
    }

    public synchronized List<StepRecord> snapshot() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }
}
