package com.example.progress.notifier.service;

import com.example.progress.notifier.dto.ResearchQueryRequest;
import com.example.progress.notifier.dto.WorkflowSnapshot;
import com.example.progress.notifier.dto.WorkflowSubmissionResponse;
import com.example.progress.notifier.model.WorkflowDefinition;
import com.example.progress.notifier.workflow.StageWorkerResolver;
import com.example.progress.notifier.workflow.WorkflowProgressEngine;
import com.example.progress.shared.aspect.Monitored;
import com.example.progress.shared.config.AppProperties;
import com.example.progress.shared.util.WorkflowIds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Accepts workflow submissions, runs each one on the workflow scheduler and keeps it queryable
 * until it has been finished for longer than the retention period.
 */
@Service
@Slf4j
@Monitored("service")
public class WorkflowService {

    private final Map<String, WorkflowProgressEngine> workflows = new ConcurrentHashMap<>();

    private final ConnectionRegistry registry;
    private final WorkflowDefinitionRegistry definitions;
    private final StageWorkerResolver workerResolver;
    private final NotificationEnvelopeFactory envelopeFactory;
    private final AppProperties appProperties;
    private final Scheduler workflowScheduler;
    private final Clock clock;

    public WorkflowService(ConnectionRegistry registry,
                           WorkflowDefinitionRegistry definitions,
                           StageWorkerResolver workerResolver,
                           NotificationEnvelopeFactory envelopeFactory,
                           AppProperties appProperties,
                           @Qualifier("workflowScheduler") Scheduler workflowScheduler,
                           Clock clock) {
        this.registry = registry;
        this.definitions = definitions;
        this.workerResolver = workerResolver;
        this.envelopeFactory = envelopeFactory;
        this.appProperties = appProperties;
        this.workflowScheduler = workflowScheduler;
        this.clock = clock;
    }

    public WorkflowSubmissionResponse submit(ResearchQueryRequest request) {
        String type = request.getWorkflowType() != null && !request.getWorkflowType().isBlank()
                ? request.getWorkflowType()
                : appProperties.getWorkflow().getDefaultType();
        WorkflowDefinition definition = definitions.require(type);
        String workflowId = WorkflowIds.newWorkflowId();

        start(workflowId, request.getUserId(), request.getQuery(), request.getMetadata(), definition);

        String query = request.getQuery();
        String preview = query.length() > 50 ? query.substring(0, 50) : query;
        return new WorkflowSubmissionResponse(workflowId, WorkflowSubmissionResponse.INITIATED,
                "Research workflow started for query: " + preview + "...");
    }

    /**
     * Creates and starts a workflow under a caller-chosen id.
     *
     * @throws IllegalArgumentException if a workflow with this id is already tracked
     */
    public WorkflowProgressEngine start(String workflowId, String userId, String query,
                                        Map<String, Object> metadata, WorkflowDefinition definition) {
        WorkflowProgressEngine engine = new WorkflowProgressEngine(workflowId, userId, query, metadata,
                definition, workerResolver, envelopeFactory, clock);
        if (workflows.putIfAbsent(workflowId, engine) != null) {
            throw new IllegalArgumentException("Workflow already exists: " + workflowId);
        }
        log.info("Submitting {} workflow {} for user {}", definition.getName(), workflowId, userId);
        engine.execute(registry)
                .subscribeOn(workflowScheduler)
                .subscribe(
                        status -> log.info("Workflow {} finished with status {}", workflowId, status.wireName()),
                        error -> log.error("Workflow {} terminated unexpectedly", workflowId, error));
        return engine;
    }

    public Optional<WorkflowSnapshot> status(String workflowId) {
        return Optional.ofNullable(workflows.get(workflowId)).map(WorkflowProgressEngine::snapshot);
    }

    public long activeCount() {
        return workflows.values().stream().filter(engine -> !engine.getStatus().isTerminal()).count();
    }

    public int trackedCount() {
        return workflows.size();
    }

    /**
     * Forgets terminal workflows that finished longer ago than {@code progress.workflow.retention}.
     */
    @Scheduled(fixedDelayString = "${progress.workflow.retention-sweep-interval-ms:60000}")
    public void evictExpiredWorkflows() {
        Instant cutoff = clock.instant().minus(appProperties.getWorkflow().getRetention());
        int before = workflows.size();
        workflows.values().removeIf(engine -> engine.getStatus().isTerminal()
                && engine.getFinishedAt() != null
                && engine.getFinishedAt().isBefore(cutoff));
        int evicted = before - workflows.size();
        if (evicted > 0) {
            log.info("Evicted {} finished workflows older than {}", evicted, appProperties.getWorkflow().getRetention());
        }
    }
}
