package io.agentrelay.runtime;

public final class AgentFailureException extends RuntimeException {
    private final String stepName;
    private final String agentId;

    public AgentFailureException(String stepName, String agentId, String message, Throwable cause) {
        super(message == null || message.isBlank() ? "Agent " + agentId + " failed" : message, cause);
        this.stepName = stepName;
        this.agentId = agentId;
    }

    public String stepName() {
        return stepName;
    }

    public String agentId() {
        return agentId;
    }
}
