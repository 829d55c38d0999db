package io.taskwire.agent;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class AgentRegistry {
    private final Map<String, Agent> agents = new ConcurrentHashMap<>();

    public static AgentRegistry withBuiltins() {
        AgentRegistry registry = new AgentRegistry();
        registry.register(new EchoAgent());
        registry.register(new FailAgent());
        return registry;
    }

    public void register(Agent agent) {
        agents.put(agent.id(), agent);
    }

    public Optional<Agent> findById(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public Collection<String> listAgentIds() {
        return agents.keySet();
    }

    public List<Agent> agents() {
        return List.copyOf(agents.values());
    }
}
