package com.example.progress.shared.codec;

import com.example.progress.shared.dto.ClientCommand;
import com.example.progress.shared.dto.NotificationEnvelope;
import com.example.progress.shared.exception.EnvelopeEncodingException;
import com.example.progress.shared.util.Constants.EnvelopeType;
import com.example.progress.shared.util.Constants.Fields;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Defines the wire shape of everything pushed to and read from clients.
 * <p>
 * Outbound envelopes become one flat JSON object: {@code type}, {@code timestamp}, then each
 * payload field. {@link EnvelopeType#TEXT} envelopes are written as their raw content.
 * Inbound text is decoded leniently: anything that is not a JSON object with a textual
 * {@code type} is classified as plain text rather than rejected.
 */
@Slf4j
@Component
public class EnvelopeCodec {

    private final ObjectMapper objectMapper;

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(NotificationEnvelope envelope) {
        validate(envelope);
        if (envelope.getType() == EnvelopeType.TEXT) {
            Object content = envelope.get(Fields.CONTENT);
            return content == null ? "" : content.toString();
        }
        ObjectNode node = objectMapper.createObjectNode();
        node.put(Fields.TYPE, envelope.getType().wireName());
        node.put(Fields.TIMESTAMP, envelope.getTimestamp());
        try {
            for (Map.Entry<String, Object> field : envelope.getPayload().entrySet()) {
                if (field.getValue() != null) {
                    node.set(field.getKey(), objectMapper.valueToTree(field.getValue()));
                }
            }
            return objectMapper.writeValueAsString(node);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new EnvelopeEncodingException(
                    "Cannot serialize " + envelope.getType().wireName() + " envelope: " + e.getMessage(), e, envelope);
        }
    }

    public ClientCommand decode(String raw) {
        if (raw == null || raw.isBlank()) {
            return ClientCommand.plainText(raw);
        }
        try {
            JsonNode node = objectMapper.readTree(raw);
            if (node == null || !node.isObject()) {
                return ClientCommand.plainText(raw);
            }
            JsonNode type = node.get(Fields.TYPE);
            if (type == null || !type.isTextual()) {
                return ClientCommand.plainText(raw);
            }
            JsonNode workflowId = node.get(Fields.WORKFLOW_ID);
            return ClientCommand.structured(
                    type.asText(),
                    workflowId != null && workflowId.isTextual() ? workflowId.asText() : null,
                    raw);
        } catch (JsonProcessingException e) {
            log.debug("Inbound message is not JSON, treating as plain text: {}", e.getOriginalMessage());
            return ClientCommand.plainText(raw);
        }
    }

    private void validate(NotificationEnvelope envelope) {
        if (envelope == null) {
            throw new EnvelopeEncodingException("Envelope is required", null);
        }
        if (envelope.getType() == null) {
            throw new EnvelopeEncodingException("Envelope type is required", envelope);
        }
        if (envelope.getTimestamp() <= 0) {
            throw new EnvelopeEncodingException("Envelope timestamp must be positive", envelope);
        }
        if (envelope.getPayload().containsKey(Fields.TYPE) || envelope.getPayload().containsKey(Fields.TIMESTAMP)) {
            throw new EnvelopeEncodingException("Payload may not redefine type or timestamp", envelope);
        }
    }
}
