package com.example.progress.shared.codec;

import com.example.progress.shared.dto.ClientCommand;
import com.example.progress.shared.dto.NotificationEnvelope;
import com.example.progress.shared.exception.EnvelopeEncodingException;
import com.example.progress.shared.util.Constants.CommandType;
import com.example.progress.shared.util.Constants.EnvelopeType;
import com.example.progress.shared.util.Constants.Fields;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvelopeCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EnvelopeCodec codec = new EnvelopeCodec(objectMapper);

    @Test
    void encodesTypeTimestampAndPayloadAsOneFlatObject() throws Exception {
        NotificationEnvelope envelope = NotificationEnvelope.builder()
                .type(EnvelopeType.AGENT_STATUS)
                .timestamp(1_700_000_000_000L)
                .field(Fields.WORKFLOW_ID, "job_42")
                .field(Fields.AGENT_NAME, "Research")
                .field(Fields.PROGRESS, 50.0)
                .build();

        JsonNode json = objectMapper.readTree(codec.encode(envelope));

        assertThat(json.get("type").asText()).isEqualTo("agent_status");
        assertThat(json.get("timestamp").asLong()).isEqualTo(1_700_000_000_000L);
        assertThat(json.get("workflow_id").asText()).isEqualTo("job_42");
        assertThat(json.get("agent_name").asText()).isEqualTo("Research");
        assertThat(json.get("progress_percentage").asDouble()).isEqualTo(50.0);
        assertThat(json.size()).isEqualTo(5);
    }

    @Test
    void omitsNullPayloadFields() throws Exception {
        Map<String, Object> payload = new java.util.HashMap<>();
        payload.put(Fields.CLIENT_ID, "c1");
        payload.put(Fields.MESSAGE, null);
        NotificationEnvelope envelope = NotificationEnvelope.builder()
                .type(EnvelopeType.CONNECTION)
                .timestamp(10L)
                .payload(payload)
                .build();

        JsonNode json = objectMapper.readTree(codec.encode(envelope));

        assertThat(json.has("client_id")).isTrue();
        assertThat(json.has("message")).isFalse();
    }

    @Test
    void encodesNestedResults() throws Exception {
        NotificationEnvelope envelope = NotificationEnvelope.builder()
                .type(EnvelopeType.WORKFLOW_COMPLETED)
                .timestamp(10L)
                .field(Fields.RESULTS, Map.of(Fields.STAGES_COMPLETED, 2))
                .build();

        JsonNode json = objectMapper.readTree(codec.encode(envelope));

        assertThat(json.get("results").get("stages_completed").asInt()).isEqualTo(2);
    }

    @Test
    void writesTextEnvelopesVerbatim() {
        NotificationEnvelope envelope = NotificationEnvelope.builder()
                .type(EnvelopeType.TEXT)
                .timestamp(10L)
                .field(Fields.CONTENT, "Received: hello")
                .build();

        assertThat(codec.encode(envelope)).isEqualTo("Received: hello");
    }

    @Test
    void rejectsEnvelopeWithoutType() {
        NotificationEnvelope envelope = NotificationEnvelope.builder().timestamp(10L).build();

        assertThatThrownBy(() -> codec.encode(envelope))
                .isInstanceOf(EnvelopeEncodingException.class)
                .hasMessageContaining("type");
    }

    @Test
    void rejectsNonPositiveTimestamp() {
        NotificationEnvelope envelope = NotificationEnvelope.builder().type(EnvelopeType.PONG).build();

        assertThatThrownBy(() -> codec.encode(envelope))
                .isInstanceOf(EnvelopeEncodingException.class)
                .hasMessageContaining("timestamp");
    }

    @Test
    void rejectsPayloadThatRedefinesReservedFields() {
        NotificationEnvelope envelope = NotificationEnvelope.builder()
                .type(EnvelopeType.PONG)
                .timestamp(10L)
                .field(Fields.TYPE, "connection")
                .build();

        assertThatThrownBy(() -> codec.encode(envelope)).isInstanceOf(EnvelopeEncodingException.class);
    }

    @Test
    void decodesPing() {
        ClientCommand command = codec.decode("{\"type\":\"ping\"}");

        assertThat(command.getType()).isEqualTo(CommandType.PING);
        assertThat(command.getRaw()).isEqualTo("{\"type\":\"ping\"}");
    }

    @Test
    void decodesSubscribeWithWorkflowId() {
        ClientCommand command = codec.decode("{\"type\":\"subscribe\",\"workflow_id\":\"job_42\"}");

        assertThat(command.getType()).isEqualTo(CommandType.SUBSCRIBE);
        assertThat(command.getWorkflowId()).isEqualTo("job_42");
    }

    @Test
    void subscribeWithoutWorkflowIdIsUnrecognized() {
        ClientCommand command = codec.decode("{\"type\":\"subscribe\"}");

        assertThat(command.getType()).isEqualTo(CommandType.UNRECOGNIZED);
        assertThat(command.getDeclaredType()).isEqualTo("subscribe");
    }

    @Test
    void unknownStructuredTypeIsUnrecognized() {
        ClientCommand command = codec.decode("{\"type\":\"dance\"}");

        assertThat(command.getType()).isEqualTo(CommandType.UNRECOGNIZED);
        assertThat(command.getDeclaredType()).isEqualTo("dance");
    }

    @Test
    void nonJsonIsPlainText() {
        ClientCommand command = codec.decode("not json at all");

        assertThat(command.getType()).isEqualTo(CommandType.PLAIN_TEXT);
        assertThat(command.getRaw()).isEqualTo("not json at all");
    }

    @Test
    void jsonWithoutTextualTypeIsPlainText() {
        assertThat(codec.decode("[1,2,3]").getType()).isEqualTo(CommandType.PLAIN_TEXT);
        assertThat(codec.decode("{\"type\":5}").getType()).isEqualTo(CommandType.PLAIN_TEXT);
        assertThat(codec.decode("{\"workflow_id\":\"x\"}").getType()).isEqualTo(CommandType.PLAIN_TEXT);
        assertThat(codec.decode("").getType()).isEqualTo(CommandType.PLAIN_TEXT);
    }
}
