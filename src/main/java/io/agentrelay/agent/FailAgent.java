package io.agentrelay.agent;

import io.agentrelay.model.Message;
import io.agentrelay.model.Response;

public final class FailAgent implements Agent {
    private final String id;

    public FailAgent() {
        this("fail");
    }

    public FailAgent(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Response process(Message message) {
        return Response.error(id, "intentional failure from " + id + " on " + message.type());
    }
}
