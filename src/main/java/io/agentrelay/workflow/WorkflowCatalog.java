package io.agentrelay.workflow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named workflow definitions, filled at configuration time.
 */
public final class WorkflowCatalog {
    public static final String PROJECT_INITIALIZATION = "project_initialization";

    private final Map<String, WorkflowDefinition> workflows = new ConcurrentHashMap<>();

    public static WorkflowCatalog withDefaults() {
        WorkflowCatalog catalog = new WorkflowCatalog();
        catalog.register(projectInitialization());
        return catalog;
    }

    /**
     * Plan, then risks assessed against the plan, then a status report over plan and risks.
     */
    public static WorkflowDefinition projectInitialization() {
        return new WorkflowDefinition(PROJECT_INITIALIZATION, List.of(
                new WorkflowStep("generate_plan", "project_plan_agent", InputMappings.original()),
                new WorkflowStep("assess_risks", "risk_assessment_agent", InputMappings.previous()),
                new WorkflowStep("generate_report", "status_reporter_agent", (accumulated, original) -> {
                    Map<String, Object> plan = accumulated.get("generate_plan");
                    Map<String, Object> risks = accumulated.get("assess_risks");
                    Map<String, Object> report = plan == null ? new LinkedHashMap<>() : new LinkedHashMap<>(plan);
                    Object riskList = risks == null ? null : risks.get("risks");
                    report.put("risks", riskList == null ? List.of() : riskList);
                    return report;
                })
        ));
    }

    public void register(WorkflowDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("workflow definition cannot be null");
        }
        workflows.put(definition.type(), definition);
    }

    public Optional<WorkflowDefinition> find(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(workflows.get(type));
    }

    public boolean contains(String type) {
        return type != null && workflows.containsKey(type);
    }

    public Collection<WorkflowDefinition> list() {
        List<WorkflowDefinition> out = new ArrayList<>(workflows.values());
        out.sort((a, b) -> a.type().compareTo(b.type()));
        return out;
    }
}
