package io.agentrelay.workflow;

public record WorkflowStep(String name, String agentId, InputMapping inputMapping) {
    public WorkflowStep {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Workflow step name cannot be empty");
        }
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("Workflow step agent cannot be empty: " + name);
        }
        inputMapping = inputMapping == null ? InputMappings.original() : inputMapping;
    }

    public static WorkflowStep of(String name, String agentId) {
        return new WorkflowStep(name, agentId, InputMappings.original());
    }
}
