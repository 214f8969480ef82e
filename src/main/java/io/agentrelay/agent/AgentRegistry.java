package io.agentrelay.agent;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class AgentRegistry {
    private final Map<String, Agent> agents = new ConcurrentHashMap<>();

    public void register(Agent agent) {
        if (agent == null || agent.id() == null || agent.id().isBlank()) {
            throw new IllegalArgumentException("agent id cannot be empty");
        }
        agents.put(agent.id(), agent);
    }

    public Optional<Agent> findById(String agentId) {
        if (agentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(agents.get(agentId));
    }

    public boolean contains(String agentId) {
        return agentId != null && agents.containsKey(agentId);
    }

    public Collection<String> listAgentIds() {
        return List.copyOf(agents.keySet().stream().sorted().toList());
    }

    public int size() {
        return agents.size();
    }
}
