package com.example.progress.notifier.agent;

import com.example.progress.notifier.workflow.StageWorker;
import com.example.progress.shared.config.AppProperties;
import com.example.progress.shared.util.Constants.AgentType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class SimulatedStageWorkerFactory implements StageWorkerFactory {

    private final AppProperties appProperties;

    @Override
    public StageWorker create(AgentType agentType) {
        String modelId = appProperties.getAgents().getModelId();
        log.info("Creating simulated {} backed by model {}", agentType.displayName(), modelId);
        return new SimulatedAgentWorker(agentType, modelId);
    }
}
