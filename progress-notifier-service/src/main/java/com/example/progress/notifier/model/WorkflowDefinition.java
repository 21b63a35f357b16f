package com.example.progress.notifier.model;

import lombok.Value;

import java.util.List;

/**
 * A named, ordered list of stages. Shared read-only by every workflow run of this type.
 */
@Value
public class WorkflowDefinition {

    String name;
    List<StageDescriptor> stages;

    public WorkflowDefinition(String name, List<StageDescriptor> stages) {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("Workflow definition '" + name + "' has no stages");
        }
        this.name = name;
        this.stages = List.copyOf(stages);
    }
}
