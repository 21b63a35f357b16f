package com.example.progress.shared.util;

import java.util.UUID;

public final class WorkflowIds {

    private static final String PREFIX = "workflow_";

    private WorkflowIds() {}

    /**
     * Random, case-insensitive identifier. Never derived from the query text, so two
     * submissions of the same query by the same user get distinct ids.
     */
    public static String newWorkflowId() {
        return PREFIX + UUID.randomUUID().toString().replace("-", "");
    }
}
