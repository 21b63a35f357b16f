package com.example.progress.notifier.agent;

import com.example.progress.notifier.workflow.StageInput;
import com.example.progress.notifier.workflow.StageWorker;
import com.example.progress.shared.exception.StageExecutionException;
import com.example.progress.shared.util.Constants.AgentType;
import lombok.Getter;
import reactor.core.publisher.Mono;

/**
 * Stand-in for a model-backed agent: waits for the stage's configured duration and reports a
 * canned result. A workflow whose metadata names this stage under {@code fail_stage} fails here.
 */
public class SimulatedAgentWorker implements StageWorker {

    public static final String FAIL_STAGE_KEY = "fail_stage";

    @Getter
    private final AgentType agentType;
    @Getter
    private final String modelId;

    public SimulatedAgentWorker(AgentType agentType, String modelId) {
        this.agentType = agentType;
        this.modelId = modelId;
    }

    @Override
    public Mono<String> run(StageInput input) {
        String stageName = input.getStage().getName();
        return Mono.delay(input.getStage().getDuration())
                .then(Mono.defer(() -> {
                    Object failStage = input.getMetadata().get(FAIL_STAGE_KEY);
                    if (failStage != null && stageName.equalsIgnoreCase(failStage.toString())) {
                        return Mono.error(new StageExecutionException(stageName,
                                agentType.displayName() + " failed to process stage " + stageName));
                    }
                    return Mono.just(agentType.displayName() + " finished " + stageName
                            + " after " + input.getPriorResults().size() + " prior stages for query: "
                            + abbreviate(input.getQuery()));
                }));
    }

    private static String abbreviate(String query) {
        if (query == null) {
            return "";
        }
        return query.length() > 50 ? query.substring(0, 50) + "..." : query;
    }
}
