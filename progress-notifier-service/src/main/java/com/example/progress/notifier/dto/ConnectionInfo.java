package com.example.progress.notifier.dto;

import lombok.Value;

import java.time.Instant;
import java.util.Set;

@Value
public class ConnectionInfo {
    String clientId;
    Instant connectedAt;
    Set<String> subscriptions;
}
