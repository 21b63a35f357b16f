package com.example.progress.shared.dto;

/**
 * Implemented by request bodies that can carry a caller-supplied correlation id, so the
 * monitoring aspect can tag the active trace span with it.
 */
public interface CorrelatedRequest {
    String getCorrelationId();
}
