package com.example.progress.notifier.agent;

import com.example.progress.notifier.dto.AgentStatusView;
import com.example.progress.notifier.model.StageDescriptor;
import com.example.progress.notifier.workflow.StageWorker;
import com.example.progress.notifier.workflow.StageWorkerResolver;
import com.example.progress.shared.config.AppProperties;
import com.example.progress.shared.util.Constants.AgentType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazily creates one agent per type the first time a stage needs it, then reuses it for every
 * later workflow. Creation of a given type happens exactly once even under concurrent demand.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentCatalog implements StageWorkerResolver {

    private final Map<AgentType, AgentHandle> agents = new ConcurrentHashMap<>();

    private final StageWorkerFactory workerFactory;
    private final AppProperties appProperties;
    private final Clock clock;

    @Override
    public StageWorker resolve(StageDescriptor stage) {
        return getOrCreate(stage.getAgentType());
    }

    public AgentHandle getOrCreate(AgentType agentType) {
        return agents.computeIfAbsent(agentType, type -> {
            AgentHandle handle = new AgentHandle(type, workerFactory.create(type), clock.instant());
            log.info("{} created", type.displayName());
            return handle;
        });
    }

    public AgentStatusView status(AgentType agentType) {
        AgentHandle handle = agents.get(agentType);
        AgentStatusView.AgentStatusViewBuilder view = AgentStatusView.builder()
                .agentType(agentType.key())
                .name(agentType.displayName())
                .description(agentType.description())
                .modelId(appProperties.getAgents().getModelId());
        if (handle == null) {
            return view.status(AgentStatusView.NOT_CREATED).build();
        }
        return view.status(AgentStatusView.READY)
                .createdAt(handle.getCreatedAt())
                .invocations(handle.getInvocationCount())
                .build();
    }

    public List<AgentStatusView> statuses() {
        return Arrays.stream(AgentType.values()).map(this::status).toList();
    }

    public int createdCount() {
        return agents.size();
    }
}
