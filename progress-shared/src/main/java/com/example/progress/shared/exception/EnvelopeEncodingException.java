package com.example.progress.shared.exception;

import com.example.progress.shared.dto.NotificationEnvelope;
import lombok.Getter;

/**
 * Raised when an envelope cannot be turned into its wire form. This always indicates a
 * programming error in whoever built the envelope, never a client problem.
 */
@Getter
public class EnvelopeEncodingException extends RuntimeException {

    private final transient NotificationEnvelope envelope;

    public EnvelopeEncodingException(String message, NotificationEnvelope envelope) {
        super(message);
        this.envelope = envelope;
    }

    public EnvelopeEncodingException(String message, Throwable cause, NotificationEnvelope envelope) {
        super(message, cause);
        this.envelope = envelope;
    }
}
