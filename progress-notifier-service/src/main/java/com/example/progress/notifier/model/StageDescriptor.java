package com.example.progress.notifier.model;

import com.example.progress.shared.util.Constants.AgentType;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class StageDescriptor {
    @NonNull
    String name;
    @NonNull
    Duration duration;
    String message;
    @NonNull
    AgentType agentType;
}
