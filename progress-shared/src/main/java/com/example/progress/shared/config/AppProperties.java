package com.example.progress.shared.config;

import com.example.progress.shared.util.Constants.AgentType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Validated
public class AppProperties {

    private String podName;

    @Valid
    private final Websocket websocket = new Websocket();
    @Valid
    private final Workflow workflow = new Workflow();
    @Valid
    private final Agents agents = new Agents();

    @Data
    public static class Websocket {
        @NotBlank
        private String path = "/ws/{clientId}";
        /** Outbound frames queued per session before a slow client is dropped. */
        @Positive
        private int sendBufferSize = 256;
    }

    @Data
    public static class Workflow {
        @NotBlank
        private String defaultType = "research";

        @NotNull
        private Duration retention = Duration.ofHours(1);

        @Positive
        private long retentionSweepIntervalMs = 60000L;

        @Positive
        private int schedulerThreads = 8;

        @NotEmpty
        private Map<String, List<@Valid Stage>> definitions = new LinkedHashMap<>(Map.of("research", researchStages()));

        private static List<Stage> researchStages() {
            List<Stage> stages = new ArrayList<>();
            stages.add(new Stage("Research", AgentType.RESEARCH, Duration.ofSeconds(3),
                    "Research agent is discovering data sources..."));
            stages.add(new Stage("Data", AgentType.DATA, Duration.ofSeconds(4),
                    "Data agent is fetching and processing datasets..."));
            stages.add(new Stage("Experiment", AgentType.EXPERIMENT, Duration.ofSeconds(5),
                    "Experiment agent is running statistical analyses..."));
            stages.add(new Stage("Critic", AgentType.CRITIC, Duration.ofSeconds(3),
                    "Critic agent is validating methodology and results..."));
            stages.add(new Stage("Visualization", AgentType.VISUALIZATION, Duration.ofSeconds(4),
                    "Visualization agent is generating charts and the final report..."));
            return stages;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Stage {
        @NotBlank
        private String name;
        @NotNull
        private AgentType agent;
        @NotNull
        private Duration duration = Duration.ZERO;
        private String message;
    }

    @Data
    public static class Agents {
        @NotBlank
        private String modelId = "anthropic.claude-3-5-sonnet-20241022-v2:0";
    }
}
