package com.example.progress.notifier.workflow;

import com.example.progress.notifier.dto.WorkflowSnapshot;
import com.example.progress.notifier.model.StageDescriptor;
import com.example.progress.notifier.model.WorkflowDefinition;
import com.example.progress.notifier.service.ConnectionRegistry;
import com.example.progress.notifier.service.NotificationEnvelopeFactory;
import com.example.progress.shared.exception.StageExecutionException;
import com.example.progress.shared.util.Constants.WorkflowStatus;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one workflow through its stages strictly in order and broadcasts every transition.
 * <p>
 * For N stages, stage i is announced as {@code processing} at i/N*100 percent and reported
 * {@code completed} at (i+1)/N*100 percent; stage i+1 never starts before stage i completed.
 * A worker error stops the run: the failure is broadcast as {@code workflow_failed} and the
 * returned Mono still completes normally, with {@link WorkflowStatus#FAILED}.
 * An engine runs at most once.
 */
@Slf4j
public class WorkflowProgressEngine {

    @Getter
    private final String workflowId;
    @Getter
    private final String userId;
    @Getter
    private final String workflowType;
    private final String query;
    private final Map<String, Object> metadata;
    private final List<StageDescriptor> stages;
    private final StageWorkerResolver workerResolver;
    private final NotificationEnvelopeFactory envelopes;
    private final Clock clock;
    private final AtomicBoolean started = new AtomicBoolean();

    // Mutable run state, guarded by this
    private WorkflowStatus status = WorkflowStatus.PENDING;
    private int currentStage = -1;
    private double progress;
    private final Map<String, String> stageResults = new LinkedHashMap<>();
    private String failedStage;
    private String error;
    private Instant startedAt;
    private Instant finishedAt;

    public WorkflowProgressEngine(String workflowId, String userId, String query, Map<String, Object> metadata,
                                  WorkflowDefinition definition, StageWorkerResolver workerResolver,
                                  NotificationEnvelopeFactory envelopes, Clock clock) {
        this(workflowId, userId, query, metadata, definition.getName(), definition.getStages(),
                workerResolver, envelopes, clock);
    }

    public WorkflowProgressEngine(String workflowId, String userId, String query, Map<String, Object> metadata,
                                  String workflowType, List<StageDescriptor> stages, StageWorkerResolver workerResolver,
                                  NotificationEnvelopeFactory envelopes, Clock clock) {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("A workflow needs at least one stage");
        }
        this.workflowId = workflowId;
        this.userId = userId;
        this.workflowType = workflowType;
        this.query = query;
        this.metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.stages = List.copyOf(stages);
        this.workerResolver = workerResolver;
        this.envelopes = envelopes;
        this.clock = clock;
    }

    /**
     * Runs the workflow, broadcasting through the given registry. Nothing happens until the
     * returned Mono is subscribed; subscribing a second time signals {@link IllegalStateException}.
     */
    public Mono<WorkflowStatus> execute(ConnectionRegistry registry) {
        return Mono.defer(() -> {
            if (!started.compareAndSet(false, true)) {
                return Mono.error(new IllegalStateException("Workflow " + workflowId + " was already started"));
            }
            markRunning();
            log.info("Workflow {} started for user {} with {} stages", workflowId, userId, stages.size());
            return Flux.range(0, stages.size())
                    .concatMap(index -> runStage(index, registry))
                    .then(Mono.fromCallable(() -> complete(registry)))
                    .onErrorResume(e -> Mono.fromCallable(() -> fail(e, registry)));
        });
    }

    private Mono<String> runStage(int index, ConnectionRegistry registry) {
        StageDescriptor stage = stages.get(index);
        return Mono.defer(() -> {
            StageInput input = beginStage(index, stage);
            registry.broadcast(envelopes.stageStarted(workflowId, userId, stage.getName(), stage.getMessage(),
                    progressAt(index)));
            log.debug("Workflow {} stage {} ({}/{}) started", workflowId, stage.getName(), index + 1, stages.size());

            return Mono.defer(() -> workerResolver.resolve(stage).run(input))
                    .defaultIfEmpty("")
                    .onErrorMap(e -> !(e instanceof StageExecutionException),
                            e -> new StageExecutionException(stage.getName(), describe(e), e))
                    .doOnNext(result -> {
                        double completed = finishStage(index, stage, result);
                        registry.broadcast(envelopes.stageCompleted(workflowId, userId, stage.getName(), stage.getMessage(),
                                completed, result));
                        log.debug("Workflow {} stage {} completed", workflowId, stage.getName());
                    });
        });
    }

    private WorkflowStatus complete(ConnectionRegistry registry) {
        Duration elapsed;
        synchronized (this) {
            status = WorkflowStatus.COMPLETED;
            progress = 100.0;
            finishedAt = clock.instant();
            elapsed = Duration.between(startedAt, finishedAt);
        }
        double configuredSeconds = configuredDuration().toMillis() / 1000.0;
        double elapsedSeconds = elapsed.toMillis() / 1000.0;
        registry.broadcast(envelopes.workflowCompleted(workflowId, userId, stages.size(),
                configuredSeconds, elapsedSeconds, summary()));
        log.info("Workflow {} completed in {}s (configured {}s)", workflowId, elapsedSeconds, configuredSeconds);
        return WorkflowStatus.COMPLETED;
    }

    private Duration configuredDuration() {
        return stages.stream().map(StageDescriptor::getDuration).reduce(Duration.ZERO, Duration::plus);
    }

    private WorkflowStatus fail(Throwable cause, ConnectionRegistry registry) {
        String stageName;
        String message = describe(cause);
        double at;
        synchronized (this) {
            stageName = cause instanceof StageExecutionException see ? see.getStageName()
                    : stages.get(Math.max(currentStage, 0)).getName();
            status = WorkflowStatus.FAILED;
            failedStage = stageName;
            error = message;
            finishedAt = clock.instant();
            at = progress;
        }
        log.error("Workflow {} failed in stage {}: {}", workflowId, stageName, message, cause);
        try {
            registry.broadcast(envelopes.workflowFailed(workflowId, userId, stageName, message, at));
        } catch (RuntimeException e) {
            log.error("Could not broadcast failure of workflow {}", workflowId, e);
        }
        return WorkflowStatus.FAILED;
    }

    private synchronized void markRunning() {
        status = WorkflowStatus.RUNNING;
        startedAt = clock.instant();
    }

    private synchronized StageInput beginStage(int index, StageDescriptor stage) {
        currentStage = index;
        progress = progressAt(index);
        return new StageInput(workflowId, stage, query, metadata,
                Collections.unmodifiableMap(new LinkedHashMap<>(stageResults)));
    }

    private synchronized double finishStage(int index, StageDescriptor stage, String result) {
        stageResults.put(stage.getName(), result);
        progress = progressAt(index + 1);
        return progress;
    }

    private double progressAt(int completedStages) {
        return completedStages * 100.0 / stages.size();
    }

    private String summary() {
        String subject = query == null ? "" : query.length() > 50 ? query.substring(0, 50) + "..." : query;
        return "Completed " + stages.size() + " stages for query: " + subject;
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    public synchronized WorkflowStatus getStatus() {
        return status;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    public synchronized WorkflowSnapshot snapshot() {
        StageDescriptor current = currentStage >= 0 ? stages.get(currentStage) : null;
        return WorkflowSnapshot.builder()
                .workflowId(workflowId)
                .userId(userId)
                .workflowType(workflowType)
                .status(status)
                .progressPercentage(progress)
                .currentAgent(current != null && status == WorkflowStatus.RUNNING ? current.getAgentType().key() : null)
                .message(statusMessage(current))
                .error(error)
                .stagesCompleted(stageResults.size())
                .totalStages(stages.size())
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .build();
    }

    private String statusMessage(StageDescriptor current) {
        switch (status) {
            case PENDING:
                return "Workflow is queued";
            case RUNNING:
                return current != null ? current.getMessage() : "Workflow is starting";
            case COMPLETED:
                return "Research workflow completed successfully";
            default:
                return "Research workflow failed during " + failedStage + " stage";
        }
    }
}
