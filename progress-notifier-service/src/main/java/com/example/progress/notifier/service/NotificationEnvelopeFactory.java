package com.example.progress.notifier.service;

import com.example.progress.shared.dto.NotificationEnvelope;
import com.example.progress.shared.util.Constants;
import com.example.progress.shared.util.Constants.EnvelopeType;
import com.example.progress.shared.util.Constants.Fields;
import com.example.progress.shared.util.Constants.StageStatus;
import com.example.progress.shared.util.Constants.WorkflowStatus;
import com.example.progress.shared.util.MonotonicClock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds every envelope the service pushes, stamping each with the monotonic clock.
 */
@Component
@RequiredArgsConstructor
public class NotificationEnvelopeFactory {

    static final String CONNECTED_MESSAGE = "Connected to workflow progress notifications";

    private final MonotonicClock clock;

    public NotificationEnvelope connectionEstablished(String clientId) {
        return envelope(EnvelopeType.CONNECTION)
                .field(Fields.STATUS, "connected")
                .field(Fields.CLIENT_ID, clientId)
                .field(Fields.MESSAGE, CONNECTED_MESSAGE)
                .build();
    }

    public NotificationEnvelope pong() {
        return envelope(EnvelopeType.PONG).build();
    }

    public NotificationEnvelope subscriptionConfirmed(String workflowId) {
        return envelope(EnvelopeType.SUBSCRIPTION_CONFIRMED)
                .field(Fields.WORKFLOW_ID, workflowId)
                .field(Fields.STATUS, "subscribed")
                .build();
    }

    public NotificationEnvelope stageStarted(String workflowId, String userId, String stageName,
                                             String message, double progress) {
        return stage(workflowId, userId, stageName, StageStatus.PROCESSING, message, progress).build();
    }

    public NotificationEnvelope stageCompleted(String workflowId, String userId, String stageName,
                                               String message, double progress, String result) {
        return stage(workflowId, userId, stageName, StageStatus.COMPLETED, message, progress)
                .field(Fields.RESULT, result)
                .build();
    }

    /**
     * @param totalDurationSeconds sum of the configured stage durations
     * @param elapsedSeconds       wall-clock time the run actually took
     */
    public NotificationEnvelope workflowCompleted(String workflowId, String userId, int stagesCompleted,
                                                  double totalDurationSeconds, double elapsedSeconds,
                                                  String summary) {
        Map<String, Object> results = new LinkedHashMap<>();
        results.put(Fields.STAGES_COMPLETED, stagesCompleted);
        results.put(Fields.TOTAL_DURATION_SECONDS, totalDurationSeconds);
        results.put(Fields.ELAPSED_SECONDS, elapsedSeconds);
        results.put(Fields.SUMMARY, summary);
        return envelope(EnvelopeType.WORKFLOW_COMPLETED)
                .field(Fields.WORKFLOW_ID, workflowId)
                .field(Fields.STATUS, WorkflowStatus.COMPLETED.wireName())
                .field(Fields.MESSAGE, "Research workflow completed successfully")
                .field(Fields.PROGRESS, 100.0)
                .field(Fields.USER_ID, userId)
                .field(Fields.RESULTS, results)
                .build();
    }

    public NotificationEnvelope workflowFailed(String workflowId, String userId, String stageName,
                                               String error, double progress) {
        return envelope(EnvelopeType.WORKFLOW_FAILED)
                .field(Fields.WORKFLOW_ID, workflowId)
                .field(Fields.STATUS, WorkflowStatus.FAILED.wireName())
                .field(Fields.AGENT_NAME, stageName)
                .field(Fields.ERROR, error)
                .field(Fields.MESSAGE, "Research workflow failed during " + stageName + " stage")
                .field(Fields.PROGRESS, progress)
                .field(Fields.USER_ID, userId)
                .build();
    }

    public NotificationEnvelope textEcho(String original) {
        return envelope(EnvelopeType.TEXT)
                .field(Fields.CONTENT, Constants.ECHO_PREFIX + original)
                .build();
    }

    private NotificationEnvelope.NotificationEnvelopeBuilder stage(String workflowId, String userId, String stageName,
                                                                  StageStatus status, String message, double progress) {
        return envelope(EnvelopeType.AGENT_STATUS)
                .field(Fields.WORKFLOW_ID, workflowId)
                .field(Fields.AGENT_NAME, stageName)
                .field(Fields.STATUS, status.wireName())
                .field(Fields.MESSAGE, message)
                .field(Fields.PROGRESS, progress)
                .field(Fields.USER_ID, userId);
    }

    private NotificationEnvelope.NotificationEnvelopeBuilder envelope(EnvelopeType type) {
        return NotificationEnvelope.builder().type(type).timestamp(clock.millis());
    }
}
