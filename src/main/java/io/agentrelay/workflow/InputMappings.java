package io.agentrelay.workflow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class InputMappings {
    public static final String ORIGINAL = "original";
    public static final String PREVIOUS = "previous";
    public static final String ORIGINAL_WITH_PREVIOUS = "original_with_previous";
    public static final String ACCUMULATED = "accumulated";

    private InputMappings() {
    }

    public static InputMapping original() {
        return (accumulated, original) -> copy(original);
    }

    /**
     * Result of the most recent step, or the original data for the first step.
     */
    public static InputMapping previous() {
        return (accumulated, original) -> {
            Map<String, Object> last = lastResult(accumulated);
            return last == null ? copy(original) : copy(last);
        };
    }

    public static InputMapping originalWithPrevious() {
        return (accumulated, original) -> {
            Map<String, Object> merged = copy(original);
            Map<String, Object> last = lastResult(accumulated);
            if (last != null) {
                merged.putAll(last);
            }
            return merged;
        };
    }

    /**
     * Original data plus every prior step's result nested under that step's name.
     */
    public static InputMapping accumulated() {
        return (accumulated, original) -> {
            Map<String, Object> merged = copy(original);
            if (accumulated != null) {
                for (Map.Entry<String, Map<String, Object>> entry : accumulated.entrySet()) {
                    merged.put(entry.getKey(), entry.getValue() == null ? Map.of() : copy(entry.getValue()));
                }
            }
            return merged;
        };
    }

    public static InputMapping byName(String raw) {
        String name = raw == null || raw.isBlank() ? ORIGINAL : raw.trim().toLowerCase(Locale.ROOT);
        return switch (name) {
            case ORIGINAL -> original();
            case PREVIOUS -> previous();
            case ORIGINAL_WITH_PREVIOUS -> originalWithPrevious();
            case ACCUMULATED -> accumulated();
            default -> throw new IllegalArgumentException("Unknown input mapping: " + raw);
        };
    }

    private static Map<String, Object> lastResult(Map<String, Map<String, Object>> accumulated) {
        if (accumulated == null || accumulated.isEmpty()) {
            return null;
        }
        List<Map<String, Object>> results = new ArrayList<>(accumulated.values());
        return results.get(results.size() - 1);
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? new LinkedHashMap<>() : new LinkedHashMap<>(source);
    }
}
