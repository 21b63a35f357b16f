package com.example.progress.notifier.agent;

import com.example.progress.notifier.workflow.StageInput;
import com.example.progress.notifier.workflow.StageWorker;
import com.example.progress.shared.util.Constants.AgentType;
import lombok.Getter;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A created agent: its worker plus the bookkeeping shown by the agent status endpoints.
 */
@Getter
public class AgentHandle implements StageWorker {

    private final AgentType agentType;
    private final StageWorker worker;
    private final Instant createdAt;
    private final AtomicLong invocations = new AtomicLong();

    public AgentHandle(AgentType agentType, StageWorker worker, Instant createdAt) {
        this.agentType = agentType;
        this.worker = worker;
        this.createdAt = createdAt;
    }

    @Override
    public Mono<String> run(StageInput input) {
        invocations.incrementAndGet();
        return worker.run(input);
    }

    public long getInvocationCount() {
        return invocations.get();
    }
}
