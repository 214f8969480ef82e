package io.agentrelay.agent;

import io.agentrelay.model.Message;
import io.agentrelay.model.Response;

/**
 * Uniform processing contract for every unit of work the orchestrator can dispatch to.
 *
 * <p>Implementations that block should do so interruptibly: the orchestrator cancels in-flight
 * work by interrupting the thread that runs {@link #process(Message)}.
 */
public interface Agent {
    String id();

    Response process(Message message) throws Exception;
}
