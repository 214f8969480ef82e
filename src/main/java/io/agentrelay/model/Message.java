package io.agentrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Message(
        @JsonProperty("type") String type,
        @JsonProperty("data") Map<String, Object> data,
        @JsonProperty("timestamp") String timestamp
) {
    public Message {
        data = data == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        timestamp = timestamp == null || timestamp.isBlank() ? Instant.now().toString() : timestamp;
    }

    public static Message of(String type, Map<String, Object> data) {
        return new Message(type, data, Instant.now().toString());
    }

    @JsonIgnore
    public boolean isWellFormed() {
        return type != null && !type.isBlank();
    }
}
