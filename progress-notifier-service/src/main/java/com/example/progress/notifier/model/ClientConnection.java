package com.example.progress.notifier.model;

import com.example.progress.notifier.channel.ClientChannel;
import lombok.Getter;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One live client session. Owned by the connection registry; identity is the instance, not the
 * client id, so a reconnect under the same id produces a distinct connection.
 */
@Getter
public class ClientConnection {

    private final String clientId;
    private final ClientChannel channel;
    private final Instant connectedAt;
    private final Set<String> subscriptions = ConcurrentHashMap.newKeySet();

    public ClientConnection(String clientId, ClientChannel channel, Instant connectedAt) {
        this.clientId = clientId;
        this.channel = channel;
        this.connectedAt = connectedAt;
    }

    public void send(String frame) {
        channel.send(frame);
    }

    public void close() {
        channel.close();
    }

    public Set<String> getSubscriptions() {
        return Set.copyOf(subscriptions);
    }

    public void addSubscription(String workflowId) {
        subscriptions.add(workflowId);
    }

    @Override
    public String toString() {
        return "ClientConnection[" + clientId + " since " + connectedAt + "]";
    }
}
