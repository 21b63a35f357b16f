package com.example.progress.shared.dto;

import com.example.progress.shared.util.Constants.EnvelopeType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A typed, timestamped notification pushed to clients. Payload fields are written flat next to
 * {@code type} and {@code timestamp} by the codec. Instances are immutable once built.
 */
@Value
@Builder
public class NotificationEnvelope {

    EnvelopeType type;

    long timestamp;

    @Singular("field")
    Map<String, Object> payload;

    public Object get(String field) {
        return payload.get(field);
    }
}
