package com.example.progress.notifier.service;

import com.example.progress.notifier.model.StageDescriptor;
import com.example.progress.notifier.model.WorkflowDefinition;
import com.example.progress.shared.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Workflow definitions built once from {@code progress.workflow.definitions}.
 */
@Component
@Slf4j
public class WorkflowDefinitionRegistry {

    private final Map<String, WorkflowDefinition> definitions;

    public WorkflowDefinitionRegistry(AppProperties appProperties) {
        Map<String, WorkflowDefinition> built = new LinkedHashMap<>();
        appProperties.getWorkflow().getDefinitions().forEach((type, stages) -> {
            List<StageDescriptor> descriptors = stages.stream()
                    .map(stage -> StageDescriptor.builder()
                            .name(stage.getName())
                            .agentType(stage.getAgent())
                            .duration(stage.getDuration())
                            .message(stage.getMessage())
                            .build())
                    .toList();
            String key = type.toLowerCase(Locale.ROOT);
            built.put(key, new WorkflowDefinition(key, descriptors));
            log.info("Loaded workflow definition '{}' with {} stages", key, descriptors.size());
        });
        this.definitions = Collections.unmodifiableMap(built);
    }

    public Optional<WorkflowDefinition> find(String workflowType) {
        if (workflowType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(definitions.get(workflowType.trim().toLowerCase(Locale.ROOT)));
    }

    public WorkflowDefinition require(String workflowType) {
        return find(workflowType)
                .orElseThrow(() -> new IllegalArgumentException("Unknown workflow type: " + workflowType));
    }

    public Set<String> types() {
        return definitions.keySet();
    }
}
