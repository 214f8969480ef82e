package io.agentrelay.agent;

import com.fasterxml.jackson.core.type.TypeReference;
import io.agentrelay.model.Message;
import io.agentrelay.model.Response;
import io.agentrelay.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external command per message: the message JSON goes to stdin and stdout must be a JSON
 * object, which becomes the response data.
 */
public final class ScriptAgent implements Agent {
    private static final int MAX_ERROR_CHARS = 512;
    private static final long OUTPUT_CLOSE_TIMEOUT_MS = 5_000L;
    private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {
    };

    private final String id;
    private final List<String> command;
    private final long timeoutMs;

    public ScriptAgent(String id, List<String> command, long timeoutMs) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("script agent id cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script agent command cannot be empty: " + id);
        }
        this.id = id;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public String id() {
        return id;
    }

    public List<String> command() {
        return command;
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    @Override
    public Response process(Message message) throws InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return Response.error(id, "script spawn failed: " + e.getMessage());
        }

        FutureTask<byte[]> stdout = new FutureTask<>(process.getInputStream()::readAllBytes);
        Thread reader = new Thread(stdout, "script-agent-" + id + "-stdout");
        reader.setDaemon(true);
        reader.start();

        try {
            byte[] input = Jsons.toCompactJson(message).getBytes(StandardCharsets.UTF_8);
            process.getOutputStream().write(input);
            process.getOutputStream().flush();
            process.getOutputStream().close();

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return Response.error(id, "script timeout after " + Duration.ofMillis(timeoutMs));
            }

            String combined = new String(stdout.get(OUTPUT_CLOSE_TIMEOUT_MS, TimeUnit.MILLISECONDS), StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                return Response.error(id, "script exit=" + process.exitValue() + " output=" + truncate(combined));
            }
            return parseOutput(combined);
        } catch (InterruptedException e) {
            // Cancelled by the orchestrator: the child must not outlive the run.
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw e;
        } catch (IOException e) {
            process.destroyForcibly();
            return Response.error(id, "script execution failed: " + e.getMessage());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return Response.error(id, "script execution failed: " + cause.getMessage());
        } catch (TimeoutException e) {
            process.destroyForcibly();
            return Response.error(id, "script output not closed within " + Duration.ofMillis(OUTPUT_CLOSE_TIMEOUT_MS));
        }
    }

    private Response parseOutput(String combined) {
        String trimmed = combined == null ? "" : combined.strip();
        if (trimmed.isEmpty()) {
            return Response.success(id, Map.of());
        }
        try {
            Map<String, Object> data = Jsons.mapper().readValue(trimmed, DATA_TYPE);
            return Response.success(id, data);
        } catch (IOException e) {
            return Response.error(id, "script output is not a JSON object: " + truncate(trimmed));
        }
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
