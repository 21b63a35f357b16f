package com.example.progress.notifier.dto;

import com.example.progress.shared.dto.CorrelatedRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchQueryRequest implements CorrelatedRequest {

    @NotBlank(message = "Query is required")
    @Size(min = 10, max = 1000, message = "Query must be between 10 and 1000 characters")
    private String query;

    @NotBlank(message = "User ID is required")
    private String userId;

    @Min(value = 1, message = "Priority must be between 1 and 5")
    @Max(value = 5, message = "Priority must be between 1 and 5")
    @Builder.Default
    private int priority = 1;

    // Falls back to progress.workflow.default-type
    private String workflowType;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    private String correlationId;
}
