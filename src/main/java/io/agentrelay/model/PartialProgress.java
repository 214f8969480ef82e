package io.agentrelay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * How far a timed-out workflow got. Only step names are carried, never step payloads.
 */
public record PartialProgress(
        @JsonProperty("completed_steps") List<String> completedSteps,
        @JsonProperty("total_steps_completed") int totalStepsCompleted,
        @JsonProperty("timeout_seconds") double timeoutSeconds
) {
    public PartialProgress {
        completedSteps = completedSteps == null ? List.of() : List.copyOf(completedSteps);
        if (totalStepsCompleted != completedSteps.size()) {
            throw new IllegalArgumentException(
                    "total_steps_completed=" + totalStepsCompleted + " does not match completed_steps size=" + completedSteps.size()
            );
        }
    }

    public static PartialProgress of(List<String> completedSteps, double timeoutSeconds) {
        List<String> names = completedSteps == null ? List.of() : List.copyOf(completedSteps);
        return new PartialProgress(names, names.size(), timeoutSeconds);
    }
}
