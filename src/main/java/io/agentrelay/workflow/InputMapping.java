package io.agentrelay.workflow;

import java.util.Map;

/**
 * Builds a step's input from the results committed so far (keyed by step name, in execution
 * order) and the data the workflow was started with.
 */
@FunctionalInterface
public interface InputMapping {
    Map<String, Object> map(Map<String, Map<String, Object>> accumulatedResults, Map<String, Object> originalData);
}
