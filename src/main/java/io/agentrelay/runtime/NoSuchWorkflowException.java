package io.agentrelay.runtime;

public final class NoSuchWorkflowException extends IllegalArgumentException {
    private final String workflowType;

    public NoSuchWorkflowException(String workflowType) {
        super("Unknown workflow type: " + workflowType);
        this.workflowType = workflowType;
    }

    public String workflowType() {
        return workflowType;
    }
}
