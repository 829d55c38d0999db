package io.taskwire.agent;

public final class FailAgent implements Agent {
    @Override
    public String id() {
        return "fail";
    }

    @Override
    public AgentResult execute(AgentContext context) {
        return AgentResult.fail("intentional_failure", "intentional failure from fail agent");
    }
}
