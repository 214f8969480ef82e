package io.agentrelay.runtime;

import io.agentrelay.model.PartialProgress;
import io.agentrelay.model.StepRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads completed step names out of a ledger without trusting its shape.
 *
 * <p>Any anomaly is logged with a reason code and yields an empty list, so
 * {@code completed_steps} is always a list whose size matches {@code total_steps_completed}.
 */
public final class PartialProgressExtractor {
    public static final String REASON_LEDGER_MISSING = "ledger_missing";
    public static final String REASON_LEDGER_NOT_A_LIST = "ledger_not_a_list";
    public static final String REASON_ENTRY_MALFORMED = "entry_malformed";
    public static final String REASON_STEP_NAME_MISSING = "step_name_missing";
    public static final String REASON_EXTRACTION_FAILED = "extraction_failed";

    private static final Logger log = LoggerFactory.getLogger(PartialProgressExtractor.class);

    public PartialProgress extract(Object ledger, double timeoutSeconds) {
        return PartialProgress.of(completedStepNames(ledger), timeoutSeconds);
    }

    public List<String> completedStepNames(Object ledger) {
        try {
            if (ledger == null) {
                return anomaly(REASON_LEDGER_MISSING, "ledger is null");
            }
            if (!(ledger instanceof List<?>)) {
                return anomaly(REASON_LEDGER_NOT_A_LIST, "ledger type " + ledger.getClass().getName());
            }
            List<?> entries = (List<?>) ledger;
            List<String> names = new ArrayList<>(entries.size());
            for (int i = 0; i < entries.size(); i++) {
                Object entry = entries.get(i);
                String name;
                if (entry instanceof StepRecord) {
                    name = ((StepRecord) entry).step();
                } else if (entry instanceof Map<?, ?>) {
                    Object raw = ((Map<?, ?>) entry).get("step");
                    if (raw != null && !(raw instanceof String)) {
                        return anomaly(REASON_ENTRY_MALFORMED, "entry " + i + " step field is " + raw.getClass().getSimpleName());
                    }
                    name = (String) raw;
                } else {
                    return anomaly(REASON_ENTRY_MALFORMED, "entry " + i + " is " + (entry == null ? "null" : entry.getClass().getSimpleName()));
                }
                if (name == null || name.isBlank()) {
                    return anomaly(REASON_STEP_NAME_MISSING, "entry " + i + " has no step name");
                }
                names.add(name);
            }
            return List.copyOf(names);
        } catch (RuntimeException e) {
            return anomaly(REASON_EXTRACTION_FAILED, e.toString());
        }
    }

    private List<String> anomaly(String reason, String detail) {
        log.warn("Malformed workflow ledger, reason={} detail={}", reason, detail);
        return List.of();
    }
}
