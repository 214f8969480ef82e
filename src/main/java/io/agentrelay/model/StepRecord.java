package io.agentrelay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One committed entry of a workflow run ledger.
 */
public record StepRecord(
        @JsonProperty("step") String step,
        @JsonProperty("status") ResponseStatus status,
        @JsonProperty("result") Map<String, Object> result
) {
    public StepRecord {
        result = result == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }
}
