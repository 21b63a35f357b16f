package com.example.progress.notifier.config;

import com.example.progress.notifier.websocket.ProgressWebSocketHandler;
import com.example.progress.shared.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.WebSocketHandler;

import java.util.Map;

@Configuration
@Slf4j
public class WebSocketConfig {

    /**
     * Ordered ahead of the annotated controllers so the socket path is never shadowed.
     */
    @Bean
    public HandlerMapping progressWebSocketMapping(ProgressWebSocketHandler handler, AppProperties appProperties) {
        String path = appProperties.getWebsocket().getPath();
        log.info("Serving progress WebSocket on {}", path);
        Map<String, WebSocketHandler> mappings = Map.of(path, handler);
        return new SimpleUrlHandlerMapping(mappings, -1);
    }
}
