package com.example.progress.notifier.dto;

import com.example.progress.shared.util.Constants.WorkflowStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of one workflow, served by the status endpoint.
 */
@Value
@Builder
public class WorkflowSnapshot {
    String workflowId;
    String userId;
    String workflowType;
    WorkflowStatus status;
    double progressPercentage;
    String currentAgent;
    String message;
    String error;
    int stagesCompleted;
    int totalStages;
    Instant startedAt;
    Instant finishedAt;
}
