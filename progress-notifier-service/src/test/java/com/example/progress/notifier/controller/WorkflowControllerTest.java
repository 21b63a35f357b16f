package com.example.progress.notifier.controller;

import com.example.progress.notifier.agent.AgentCatalog;
import com.example.progress.notifier.dto.AgentStatusView;
import com.example.progress.notifier.dto.ConnectionInfo;
import com.example.progress.notifier.dto.ResearchQueryRequest;
import com.example.progress.notifier.dto.WorkflowSnapshot;
import com.example.progress.notifier.dto.WorkflowSubmissionResponse;
import com.example.progress.notifier.service.ConnectionRegistry;
import com.example.progress.notifier.service.WorkflowService;
import com.example.progress.shared.config.CorrelationIdFilter;
import com.example.progress.shared.util.Constants.AgentType;
import com.example.progress.shared.util.Constants.WorkflowStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = {WorkflowController.class, ConnectionController.class, AgentController.class})
class WorkflowControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private WorkflowService workflowService;

    @MockBean
    private ConnectionRegistry connectionRegistry;

    @MockBean
    private AgentCatalog agentCatalog;

    @Test
    void submitReturnsInitiatedWorkflow() {
        when(workflowService.submit(any(ResearchQueryRequest.class))).thenReturn(new WorkflowSubmissionResponse(
                "workflow_abc", "initiated", "Research workflow started for query: Impact of sleep on memory..."));

        webTestClient.post().uri("/api/research/submit")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "Impact of sleep on memory", "user_id", "user-1", "priority", 3))
                .exchange()
                .expectStatus().isOk()
                .expectHeader().exists(CorrelationIdFilter.CORRELATION_ID_HEADER)
                .expectBody()
                .jsonPath("$.workflow_id").isEqualTo("workflow_abc")
                .jsonPath("$.status").isEqualTo("initiated");
    }

    @Test
    void submitBindsSnakeCaseFields() {
        when(workflowService.submit(any(ResearchQueryRequest.class))).thenAnswer(invocation -> {
            ResearchQueryRequest request = invocation.getArgument(0);
            assertThat(request.getUserId()).isEqualTo("user-1");
            assertThat(request.getWorkflowType()).isEqualTo("research");
            assertThat(request.getMetadata()).containsEntry("fail_stage", "Data");
            assertThat(request.getPriority()).isEqualTo(1);
            return new WorkflowSubmissionResponse("workflow_abc", "initiated", "ok");
        });

        webTestClient.post().uri("/api/research/submit")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "Impact of sleep on memory", "user_id", "user-1",
                        "workflow_type", "research", "metadata", Map.of("fail_stage", "Data")))
                .exchange()
                .expectStatus().isOk();
    }

    @Test
    void tooShortQueryIsRejected() {
        webTestClient.post().uri("/api/research/submit")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "short", "user_id", "user-1"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Validation Failed")
                .jsonPath("$.message").isEqualTo("Query must be between 10 and 1000 characters");

        verify(workflowService, never()).submit(any());
    }

    @Test
    void priorityOutOfRangeIsRejected() {
        webTestClient.post().uri("/api/research/submit")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "Impact of sleep on memory", "user_id", "user-1", "priority", 9))
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void unknownWorkflowTypeIsBadRequest() {
        when(workflowService.submit(any(ResearchQueryRequest.class)))
                .thenThrow(new IllegalArgumentException("Unknown workflow type: astrology"));

        webTestClient.post().uri("/api/research/submit")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "Impact of sleep on memory", "user_id", "user-1", "workflow_type", "astrology"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Unknown workflow type: astrology");
    }

    @Test
    void statusOfKnownWorkflow() {
        when(workflowService.status("workflow_abc")).thenReturn(Optional.of(WorkflowSnapshot.builder()
                .workflowId("workflow_abc")
                .userId("user-1")
                .status(WorkflowStatus.RUNNING)
                .progressPercentage(40.0)
                .currentAgent("experiment")
                .message("Experiment agent is running statistical analyses...")
                .stagesCompleted(2)
                .totalStages(5)
                .startedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build()));

        webTestClient.get().uri("/api/workflow/workflow_abc/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.workflow_id").isEqualTo("workflow_abc")
                .jsonPath("$.status").isEqualTo("running")
                .jsonPath("$.progress_percentage").isEqualTo(40.0)
                .jsonPath("$.current_agent").isEqualTo("experiment");
    }

    @Test
    void statusOfUnknownWorkflowIsNotFound() {
        when(workflowService.status("workflow_missing")).thenReturn(Optional.empty());

        webTestClient.get().uri("/api/workflow/workflow_missing/status")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.status").isEqualTo(404)
                .jsonPath("$.message").isEqualTo("Workflow not found: workflow_missing")
                .jsonPath("$.path").isEqualTo("/api/workflow/workflow_missing/status");
    }

    @Test
    void websocketStatusListsClients() {
        when(connectionRegistry.connections()).thenReturn(List.of(
                new ConnectionInfo("c1", Instant.parse("2024-05-01T10:00:00Z"), Set.of("job_42"))));
        when(connectionRegistry.deliveryFailureCount()).thenReturn(0L);

        webTestClient.get().uri("/api/websocket/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.active_connections").isEqualTo(1)
                .jsonPath("$.clients[0].client_id").isEqualTo("c1")
                .jsonPath("$.clients[0].subscriptions[0]").isEqualTo("job_42");
    }

    @Test
    void disconnectDelegatesToRegistry() {
        webTestClient.post().uri(uri -> uri.path("/api/websocket/disconnect").queryParam("clientId", "c1").build())
                .exchange()
                .expectStatus().isOk();

        verify(connectionRegistry).disconnect("c1");
    }

    @Test
    void agentStatusByType() {
        when(agentCatalog.status(AgentType.CRITIC)).thenReturn(AgentStatusView.builder()
                .agentType("critic").name("Critic Agent").status(AgentStatusView.NOT_CREATED).build());

        webTestClient.get().uri("/api/agents/critic/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.agent_type").isEqualTo("critic")
                .jsonPath("$.status").isEqualTo("not_created");
    }

    @Test
    void unknownAgentTypeIsNotFound() {
        webTestClient.get().uri("/api/agents/wizard/status")
                .exchange()
                .expectStatus().isNotFound();
    }
}
