package com.example.progress.shared.util;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public final class Constants {

    // Private constructor to prevent instantiation
    private Constants() {}

    public static final String ECHO_PREFIX = "Received: ";

    /**
     * Field names of the flat JSON envelopes pushed to clients.
     */
    public static final class Fields {
        private Fields() {}
        public static final String TYPE = "type";
        public static final String TIMESTAMP = "timestamp";
        public static final String CONTENT = "content";
        public static final String CLIENT_ID = "client_id";
        public static final String WORKFLOW_ID = "workflow_id";
        public static final String USER_ID = "user_id";
        public static final String AGENT_NAME = "agent_name";
        public static final String STATUS = "status";
        public static final String MESSAGE = "message";
        public static final String PROGRESS = "progress_percentage";
        public static final String RESULT = "result";
        public static final String RESULTS = "results";
        public static final String ERROR = "error";
        public static final String STAGES_COMPLETED = "stages_completed";
        public static final String TOTAL_DURATION_SECONDS = "total_duration_seconds";
        public static final String ELAPSED_SECONDS = "elapsed_seconds";
        public static final String SUMMARY = "summary";
    }

    public enum EnvelopeType {
        CONNECTION("connection"),
        PONG("pong"),
        SUBSCRIPTION_CONFIRMED("subscription_confirmed"),
        AGENT_STATUS("agent_status"),
        WORKFLOW_COMPLETED("workflow_completed"),
        WORKFLOW_FAILED("workflow_failed"),
        // Plain-text frame, written verbatim instead of as a JSON object
        TEXT("text");

        private final String wireName;

        EnvelopeType(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }
    }

    public enum WorkflowStatus {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }
    }

    public enum StageStatus {
        PROCESSING,
        COMPLETED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum CommandType {
        PING("ping"),
        SUBSCRIBE("subscribe"),
        // Structured command whose type we do not know
        UNRECOGNIZED(null),
        // Anything that is not a JSON object carrying a textual "type"
        PLAIN_TEXT(null);

        private final String wireName;

        CommandType(String wireName) {
            this.wireName = wireName;
        }

        public static CommandType fromWire(String type) {
            return Arrays.stream(values())
                    .filter(t -> t.wireName != null && t.wireName.equals(type))
                    .findFirst()
                    .orElse(UNRECOGNIZED);
        }
    }

    public enum AgentType {
        RESEARCH("Research Agent", "Specialized agent for discovering data sources and research information"),
        DATA("Data Agent", "Specialized agent for fetching and processing data"),
        EXPERIMENT("Experiment Agent", "Specialized agent for designing and running experiments"),
        CRITIC("Critic Agent", "Specialized agent for validating results and methodology"),
        VISUALIZATION("Visualization Agent", "Specialized agent for creating charts and reports");

        private final String displayName;
        private final String description;

        AgentType(String displayName, String description) {
            this.displayName = displayName;
            this.description = description;
        }

        public String displayName() {
            return displayName;
        }

        public String description() {
            return description;
        }

        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Optional<AgentType> fromKey(String key) {
            if (key == null) {
                return Optional.empty();
            }
            return Arrays.stream(values())
                    .filter(t -> t.key().equalsIgnoreCase(key.trim()))
                    .findFirst();
        }
    }
}
