package io.agentrelay.runtime;

public final class NoSuchAgentException extends IllegalArgumentException {
    private final String agentId;

    private NoSuchAgentException(String agentId, String message) {
        super(message);
        this.agentId = agentId;
    }

    public static NoSuchAgentException forMessageType(String messageType) {
        return new NoSuchAgentException(null, "No routing rule for message type: " + messageType);
    }

    public static NoSuchAgentException notRegistered(String agentId) {
        return new NoSuchAgentException(agentId, "Agent not found: " + agentId);
    }

    public static NoSuchAgentException forStep(String workflowType, String stepName, String agentId) {
        return new NoSuchAgentException(
                agentId,
                "Agent not found: " + agentId + " (workflow " + workflowType + ", step " + stepName + ")"
        );
    }

    public String agentId() {
        return agentId;
    }
}
