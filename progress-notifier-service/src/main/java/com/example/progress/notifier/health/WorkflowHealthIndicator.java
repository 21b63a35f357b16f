package com.example.progress.notifier.health;

import com.example.progress.notifier.agent.AgentCatalog;
import com.example.progress.notifier.service.ConnectionRegistry;
import com.example.progress.notifier.service.WorkflowDefinitionRegistry;
import com.example.progress.notifier.service.WorkflowService;
import com.example.progress.shared.config.AppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reported under the {@code progress} key of /actuator/health.
 */
@Component("progress")
@RequiredArgsConstructor
public class WorkflowHealthIndicator implements HealthIndicator {

    private final ConnectionRegistry registry;
    private final WorkflowService workflowService;
    private final AgentCatalog agentCatalog;
    private final WorkflowDefinitionRegistry definitions;
    private final AppProperties appProperties;

    @Override
    public Health health() {
        return Health.up()
                .withDetail("pod", appProperties.getPodName())
                .withDetail("activeConnections", registry.count())
                .withDetail("deliveryFailures", registry.deliveryFailureCount())
                .withDetail("runningWorkflows", workflowService.activeCount())
                .withDetail("trackedWorkflows", workflowService.trackedCount())
                .withDetail("agentsCreated", agentCatalog.createdCount())
                .withDetail("workflowTypes", definitions.types())
                .build();
    }
}
