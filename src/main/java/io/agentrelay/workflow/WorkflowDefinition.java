package io.agentrelay.workflow;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record WorkflowDefinition(String type, List<WorkflowStep> steps) {
    public WorkflowDefinition {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Workflow type cannot be empty");
        }
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Workflow must contain at least one step: " + type);
        }
        steps = List.copyOf(steps);
        Set<String> names = new HashSet<>();
        for (WorkflowStep step : steps) {
            if (!names.add(step.name())) {
                throw new IllegalArgumentException("Duplicate workflow step name: " + step.name());
            }
        }
    }

    public List<String> stepNames() {
        return steps.stream().map(WorkflowStep::name).toList();
    }
}
