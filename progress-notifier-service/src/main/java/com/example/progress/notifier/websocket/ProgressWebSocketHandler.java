package com.example.progress.notifier.websocket;

import com.example.progress.notifier.channel.SinkClientChannel;
import com.example.progress.notifier.model.ClientConnection;
import com.example.progress.notifier.service.ClientCommandHandler;
import com.example.progress.notifier.service.ConnectionRegistry;
import com.example.progress.shared.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.server.PathContainer;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.pattern.PathPattern;
import org.springframework.web.util.pattern.PathPatternParser;
import reactor.core.publisher.Mono;

/**
 * Binds one WebSocket session to the registry. Outbound frames are drained from the connection's
 * sink; inbound frames go to the {@link ClientCommandHandler}. The session ends as soon as either
 * side finishes: the client closing, or the registry closing the channel on disconnect or replacement.
 */
@Component
@Slf4j
public class ProgressWebSocketHandler implements WebSocketHandler {

    static final String CLIENT_ID_VARIABLE = "clientId";

    private final ConnectionRegistry registry;
    private final ClientCommandHandler commandHandler;
    private final PathPattern pathPattern;
    private final int sendBufferSize;

    public ProgressWebSocketHandler(ConnectionRegistry registry, ClientCommandHandler commandHandler,
                                    AppProperties appProperties) {
        this.registry = registry;
        this.commandHandler = commandHandler;
        this.pathPattern = PathPatternParser.defaultInstance.parse(appProperties.getWebsocket().getPath());
        this.sendBufferSize = appProperties.getWebsocket().getSendBufferSize();
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        return Mono.defer(() -> {
            String clientId = clientId(session);
            if (clientId == null || clientId.isBlank()) {
                log.warn("Rejecting WebSocket session {} without a client id", session.getId());
                return session.close(CloseStatus.POLICY_VIOLATION.withReason("Client id is required"));
            }

            SinkClientChannel channel = new SinkClientChannel(sendBufferSize);
            ClientConnection connection = registry.connect(clientId, channel);

            Mono<Void> outbound = session.send(channel.frames().map(session::textMessage));
            Mono<Void> inbound = commandHandler.serve(connection,
                    session.receive().map(WebSocketMessage::getPayloadAsText));

            return Mono.firstWithSignal(inbound, outbound)
                    .doFinally(signal -> registry.release(connection));
        });
    }

    String clientId(WebSocketSession session) {
        PathContainer path = PathContainer.parsePath(session.getHandshakeInfo().getUri().getRawPath());
        PathPattern.PathMatchInfo match = pathPattern.matchAndExtract(path);
        return match == null ? null : match.getUriVariables().get(CLIENT_ID_VARIABLE);
    }
}
