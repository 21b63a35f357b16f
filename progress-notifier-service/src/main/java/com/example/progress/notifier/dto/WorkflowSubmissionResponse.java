package com.example.progress.notifier.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class WorkflowSubmissionResponse {
    public static final String INITIATED = "initiated";

    private String workflowId;
    private String status;
    private String message;
}
