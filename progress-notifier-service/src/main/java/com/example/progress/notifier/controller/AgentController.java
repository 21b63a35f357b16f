package com.example.progress.notifier.controller;

import com.example.progress.notifier.agent.AgentCatalog;
import com.example.progress.notifier.dto.AgentStatusView;
import com.example.progress.shared.util.Constants.AgentType;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/agents")
@RequiredArgsConstructor
public class AgentController {

    private final AgentCatalog agentCatalog;

    @GetMapping("/status")
    public ResponseEntity<List<AgentStatusView>> getAllAgentStatus() {
        return ResponseEntity.ok(agentCatalog.statuses());
    }

    @GetMapping("/{agentType}/status")
    public ResponseEntity<AgentStatusView> getAgentStatus(@PathVariable String agentType) {
        AgentType type = AgentType.fromKey(agentType)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown agent type: " + agentType));
        return ResponseEntity.ok(agentCatalog.status(type));
    }
}
