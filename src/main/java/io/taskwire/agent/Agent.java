package io.taskwire.agent;

public interface Agent {
    String id();

    AgentResult execute(AgentContext context) throws Exception;
}
