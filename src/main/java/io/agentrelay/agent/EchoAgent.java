package io.agentrelay.agent;

import io.agentrelay.model.Message;
import io.agentrelay.model.Response;

import java.util.LinkedHashMap;
import java.util.Map;

public final class EchoAgent implements Agent {
    private final String id;

    public EchoAgent() {
        this("echo");
    }

    public EchoAgent(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("echo agent id cannot be empty");
        }
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Response process(Message message) {
        Map<String, Object> data = new LinkedHashMap<>(message.data());
        data.put("received_type", message.type());
        data.put("received_at", message.timestamp());
        return Response.success(id, data);
    }
}
