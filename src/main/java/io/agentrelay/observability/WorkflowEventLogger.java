package io.agentrelay.observability;

import io.agentrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured events for workflow runs that did not complete.
 *
 * <p>Each event is one compact JSON object on the {@value #LOGGER_NAME} logger, and optionally one
 * line of a JSONL file. Events carry step names and counts only, never message or step payloads.
 */
public final class WorkflowEventLogger {
    public static final String LOGGER_NAME = "io.agentrelay.events";
    public static final String WORKFLOW_TIMEOUT = "workflow_timeout";
    public static final String WORKFLOW_ERROR = "workflow_error";
    public static final String WORKFLOW_SHORT_TIMEOUT = "workflow_short_timeout";

    private static final Logger events = LoggerFactory.getLogger(LOGGER_NAME);
    private static final Logger log = LoggerFactory.getLogger(WorkflowEventLogger.class);

    private final Path eventLogFile;

    public WorkflowEventLogger() {
        this(null);
    }

    public WorkflowEventLogger(Path eventLogFile) {
        this.eventLogFile = eventLogFile;
        if (eventLogFile == null) {
            return;
        }
        try {
            Path parent = eventLogFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(eventLogFile)) {
                try {
                    Files.createFile(eventLogFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize event log file: " + eventLogFile, e);
        }
    }

    public Map<String, Object> workflowTimeout(
            String workflowType,
            String messageType,
            double timeoutSeconds,
            List<String> completedSteps
    ) {
        Map<String, Object> row = baseRow(WORKFLOW_TIMEOUT, workflowType, messageType);
        row.put("timeout_seconds", timeoutSeconds);
        putSteps(row, completedSteps);
        String line = emit(row);
        events.warn("{}", line);
        return row;
    }

    public Map<String, Object> workflowError(
            String workflowType,
            String messageType,
            Double timeoutSeconds,
            List<String> completedSteps,
            String failedStep,
            String error
    ) {
        Map<String, Object> row = baseRow(WORKFLOW_ERROR, workflowType, messageType);
        if (timeoutSeconds != null) {
            row.put("timeout_seconds", timeoutSeconds);
        }
        putSteps(row, completedSteps);
        if (failedStep != null) {
            row.put("failed_step", failedStep);
        }
        row.put("error", SensitiveDataMasker.maskText(error));
        String line = emit(row);
        events.error("{}", line);
        return row;
    }

    public Map<String, Object> shortTimeout(
            String workflowType,
            String messageType,
            double timeoutSeconds,
            double thresholdSeconds
    ) {
        Map<String, Object> row = baseRow(WORKFLOW_SHORT_TIMEOUT, workflowType, messageType);
        row.put("timeout_seconds", timeoutSeconds);
        row.put("threshold_seconds", thresholdSeconds);
        String line = emit(row);
        events.warn("{}", line);
        return row;
    }

    public Path eventLogFile() {
        return eventLogFile;
    }

    private Map<String, Object> baseRow(String event, String workflowType, String messageType) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("event", event);
        row.put("timestamp", Instant.now().toString());
        row.put("workflow_type", workflowType);
        row.put("message_type", messageType);
        return row;
    }

    private void putSteps(Map<String, Object> row, List<String> completedSteps) {
        List<String> names = completedSteps == null ? List.of() : List.copyOf(completedSteps);
        row.put("completed_steps_count", names.size());
        row.put("completed_steps", names);
    }

    private synchronized String emit(Map<String, Object> row) {
        String line = Jsons.toCompactJson(row);
        if (eventLogFile != null) {
            try {
                Files.writeString(eventLogFile, line + System.lineSeparator(), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            } catch (IOException e) {
                log.error("Failed to append workflow event to {}", eventLogFile, e);
            }
        }
        return line;
    }
}
