package com.example.progress.notifier.controller;

import com.example.progress.notifier.dto.ResearchQueryRequest;
import com.example.progress.notifier.dto.WorkflowSnapshot;
import com.example.progress.notifier.dto.WorkflowSubmissionResponse;
import com.example.progress.notifier.service.WorkflowService;
import com.example.progress.shared.aspect.Monitored;
import com.example.progress.shared.exception.WorkflowNotFoundException;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
@Monitored("controller")
public class WorkflowController {

    private final WorkflowService workflowService;

    @PostMapping("/research/submit")
    @RateLimiter(name = "submitWorkflowLimiter")
    public ResponseEntity<WorkflowSubmissionResponse> submitResearchQuery(@Valid @RequestBody ResearchQueryRequest request) {
        log.info("Received research query from user: {} (priority {})", request.getUserId(), request.getPriority());
        WorkflowSubmissionResponse response = workflowService.submit(request);
        log.info("Research workflow {} initiated", response.getWorkflowId());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/workflow/{workflowId}/status")
    public ResponseEntity<WorkflowSnapshot> getWorkflowStatus(@PathVariable String workflowId) {
        return workflowService.status(workflowId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }
}
