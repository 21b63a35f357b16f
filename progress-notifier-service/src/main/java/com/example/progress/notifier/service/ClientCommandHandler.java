package com.example.progress.notifier.service;

import com.example.progress.notifier.model.ClientConnection;
import com.example.progress.shared.codec.EnvelopeCodec;
import com.example.progress.shared.dto.ClientCommand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Answers what clients send over their socket. Replies go only to the sender.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClientCommandHandler {

    private final ConnectionRegistry registry;
    private final EnvelopeCodec codec;
    private final NotificationEnvelopeFactory envelopeFactory;

    public void handle(String clientId, String text) {
        ClientCommand command = codec.decode(text);
        switch (command.getType()) {
            case PING -> registry.unicast(clientId, envelopeFactory.pong());
            case SUBSCRIBE -> {
                registry.subscribe(clientId, command.getWorkflowId());
                registry.unicast(clientId, envelopeFactory.subscriptionConfirmed(command.getWorkflowId()));
            }
            default -> {
                log.debug("Echoing {} message from client {}", command.getType(), clientId);
                registry.unicast(clientId, envelopeFactory.textEcho(command.getRaw()));
            }
        }
    }

    /**
     * Read loop for one connection. Frames are handled one at a time in arrival order. However the
     * inbound stream ends, the connection is released from the registry; stream errors are logged
     * and end the loop quietly.
     */
    public Mono<Void> serve(ClientConnection connection, Flux<String> inbound) {
        String clientId = connection.getClientId();
        return inbound
                .concatMap(text -> Mono.fromRunnable(() -> handle(clientId, text)))
                .onErrorResume(e -> {
                    log.warn("Inbound stream of client {} failed: {}", clientId, e.getMessage());
                    return Mono.empty();
                })
                .doFinally(signal -> {
                    log.debug("Inbound stream of client {} ended with {}", clientId, signal);
                    registry.release(connection);
                })
                .then();
    }
}
