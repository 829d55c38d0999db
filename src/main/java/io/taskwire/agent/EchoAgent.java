package io.taskwire.agent;

/**
 * Replies with the task parameters unchanged.
 */
public final class EchoAgent implements Agent {
    @Override
    public String id() {
        return "echo";
    }

    @Override
    public AgentResult execute(AgentContext context) {
        return AgentResult.ok(context.parameters().deepCopy());
    }
}
