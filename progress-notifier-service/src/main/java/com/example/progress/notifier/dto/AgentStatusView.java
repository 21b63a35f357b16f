package com.example.progress.notifier.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AgentStatusView {

    public static final String NOT_CREATED = "not_created";
    public static final String READY = "ready";

    String agentType;
    String name;
    String description;
    String status;
    String modelId;
    Instant createdAt;
    long invocations;
}
