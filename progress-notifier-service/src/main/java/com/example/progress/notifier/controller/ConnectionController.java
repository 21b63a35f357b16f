package com.example.progress.notifier.controller;

import com.example.progress.notifier.dto.ConnectionInfo;
import com.example.progress.notifier.service.ConnectionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/websocket")
@RequiredArgsConstructor
@Slf4j
public class ConnectionController {

    private final ConnectionRegistry registry;

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        List<ConnectionInfo> clients = registry.connections();
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("active_connections", clients.size());
        status.put("clients", clients);
        status.put("delivery_failures", registry.deliveryFailureCount());
        status.put("timestamp", ZonedDateTime.now());
        return ResponseEntity.ok(status);
    }

    @PostMapping("/disconnect")
    public ResponseEntity<String> disconnect(@RequestParam String clientId) {
        log.info("Disconnect request for client: {}", clientId);
        registry.disconnect(clientId);
        return ResponseEntity.ok("Disconnected successfully");
    }
}
