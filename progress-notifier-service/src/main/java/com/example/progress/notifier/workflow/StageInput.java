package com.example.progress.notifier.workflow;

import com.example.progress.notifier.model.StageDescriptor;
import lombok.Value;

import java.util.Map;

/**
 * Everything a stage worker gets to see: the workflow's input text and metadata, plus the
 * results of the stages that already ran, in order.
 */
@Value
public class StageInput {
    String workflowId;
    StageDescriptor stage;
    String query;
    Map<String, Object> metadata;
    Map<String, String> priorResults;
}
