package io.agentrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Uniform envelope returned by agents and by the orchestrator.
 *
 * <p>{@code partial_progress} is only ever set on {@link ResponseStatus#TIMEOUT} responses, which
 * only the orchestrator's deadline-bound path produces.
 */
public record Response(
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("status") ResponseStatus status,
        @JsonProperty("data") Map<String, Object> data,
        @JsonProperty("error") String error,
        @JsonInclude(JsonInclude.Include.NON_NULL)
        @JsonProperty("partial_progress") PartialProgress partialProgress
) {
    public Response {
        if (status == null) {
            throw new IllegalArgumentException("Response status cannot be null");
        }
        if (partialProgress != null && status != ResponseStatus.TIMEOUT) {
            throw new IllegalArgumentException("partial_progress is reserved for timeout responses");
        }
        data = data == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        timestamp = timestamp == null || timestamp.isBlank() ? Instant.now().toString() : timestamp;
    }

    public static Response success(String agentId, Map<String, Object> data) {
        return new Response(agentId, Instant.now().toString(), ResponseStatus.SUCCESS, data, null, null);
    }

    public static Response pending(String agentId, Map<String, Object> data) {
        return new Response(agentId, Instant.now().toString(), ResponseStatus.PENDING, data, null, null);
    }

    public static Response error(String agentId, String error) {
        return error(agentId, null, error);
    }

    public static Response error(String agentId, Map<String, Object> data, String error) {
        return new Response(agentId, Instant.now().toString(), ResponseStatus.ERROR, data, error, null);
    }

    public static Response timeout(String agentId, Map<String, Object> data, String error, PartialProgress partialProgress) {
        if (partialProgress == null) {
            throw new IllegalArgumentException("timeout responses require partial_progress");
        }
        return new Response(agentId, Instant.now().toString(), ResponseStatus.TIMEOUT, data, error, partialProgress);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == ResponseStatus.SUCCESS;
    }
}
