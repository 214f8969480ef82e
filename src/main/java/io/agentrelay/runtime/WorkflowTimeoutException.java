package io.agentrelay.runtime;

import io.agentrelay.model.PartialProgress;

import java.math.BigDecimal;

public final class WorkflowTimeoutException extends RuntimeException {
    private final String workflowType;
    private final PartialProgress partialProgress;

    public WorkflowTimeoutException(String workflowType, PartialProgress partialProgress) {
        super("Workflow '" + workflowType + "' timed out after " + formatSeconds(partialProgress.timeoutSeconds()) + " seconds");
        this.workflowType = workflowType;
        this.partialProgress = partialProgress;
    }

    public String workflowType() {
        return workflowType;
    }

    public PartialProgress partialProgress() {
        return partialProgress;
    }

    static String formatSeconds(double seconds) {
        return BigDecimal.valueOf(seconds).stripTrailingZeros().toPlainString();
    }
}
