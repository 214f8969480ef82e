package io.agentrelay.runtime;

import io.agentrelay.model.PartialProgress;
import io.agentrelay.model.Response;
import io.agentrelay.model.StepRecord;
import io.agentrelay.model.WorkflowState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Terminal result of one workflow run: {@code COMPLETED}, {@code FAILED} or {@code TIMED_OUT},
 * always with the ledger of committed steps.
 *
 * <p>{@code failure} is an {@link AgentFailureException} for failed runs and a
 * {@link WorkflowTimeoutException} for timed-out runs; it is returned, not thrown.
 */
public record WorkflowOutcome(
        WorkflowState state,
        String workflowType,
        String messageType,
        List<StepRecord> steps,
        String failedStep,
        RuntimeException failure,
        PartialProgress partialProgress,
        Double timeoutSeconds
) {
    public WorkflowOutcome {
        if (state == null || !state.isTerminal()) {
            throw new IllegalArgumentException("workflow outcome needs a terminal state, got: " + state);
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
        if (state == WorkflowState.TIMED_OUT && partialProgress == null) {
            throw new IllegalArgumentException("timed out outcome requires partial progress");
        }
        if (state != WorkflowState.TIMED_OUT && partialProgress != null) {
            throw new IllegalArgumentException("partial progress is reserved for timed out outcomes");
        }
    }

    public static WorkflowOutcome completed(String workflowType, String messageType, List<StepRecord> steps, Double timeoutSeconds) {
        return new WorkflowOutcome(WorkflowState.COMPLETED, workflowType, messageType, steps, null, null, null, timeoutSeconds);
    }

    public static WorkflowOutcome failed(
            String workflowType,
            String messageType,
            List<StepRecord> steps,
            String failedStep,
            AgentFailureException failure,
            Double timeoutSeconds
    ) {
        return new WorkflowOutcome(WorkflowState.FAILED, workflowType, messageType, steps, failedStep, failure, null, timeoutSeconds);
    }

    public static WorkflowOutcome timedOut(
            String workflowType,
            String messageType,
            List<StepRecord> steps,
            PartialProgress partialProgress
    ) {
        return new WorkflowOutcome(
                WorkflowState.TIMED_OUT,
                workflowType,
                messageType,
                steps,
                null,
                new WorkflowTimeoutException(workflowType, partialProgress),
                partialProgress,
                partialProgress.timeoutSeconds()
        );
    }

    public String error() {
        return failure == null ? null : failure.getMessage();
    }

    public List<String> completedStepNames() {
        return steps.stream().map(StepRecord::step).toList();
    }

    public Response toResponse(String agentId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("workflow_type", workflowType);
        data.put("state", state.name().toLowerCase(Locale.ROOT));
        data.put("steps", steps);
        return switch (state) {
            case COMPLETED -> Response.success(agentId, data);
            case FAILED -> {
                if (failedStep != null) {
                    data.put("failed_step", failedStep);
                }
                yield Response.error(agentId, data, error());
            }
            case TIMED_OUT -> Response.timeout(agentId, data, error(), partialProgress);
            default -> throw new IllegalStateException("Unexpected workflow state: " + state);
        };
    }
}
