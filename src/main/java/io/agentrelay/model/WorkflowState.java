package io.agentrelay.model;

public enum WorkflowState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMED_OUT;
    }
}
