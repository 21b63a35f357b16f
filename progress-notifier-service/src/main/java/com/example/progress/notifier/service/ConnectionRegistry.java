package com.example.progress.notifier.service;

import com.example.progress.notifier.channel.ClientChannel;
import com.example.progress.notifier.dto.ConnectionInfo;
import com.example.progress.notifier.model.ClientConnection;
import com.example.progress.shared.codec.EnvelopeCodec;
import com.example.progress.shared.dto.NotificationEnvelope;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single source of truth for which clients are connected to this process.
 * <p>
 * At most one live connection exists per client id; a reconnect replaces and closes the previous
 * one. The mapping is guarded by a private monitor that is held only for structural changes and
 * recipient snapshots. Frames are always written outside of it, so one slow client cannot stall
 * connects, disconnects or deliveries to anybody else. A connection whose channel rejects a
 * frame is dropped from the registry; the failure never reaches the caller.
 */
@Service
@Slf4j
public class ConnectionRegistry {

    private final Object lock = new Object();
    private final Map<String, ClientConnection> connections = new HashMap<>();
    private final AtomicLong deliveryFailures = new AtomicLong();

    private final EnvelopeCodec codec;
    private final NotificationEnvelopeFactory envelopeFactory;
    private final Clock clock;

    public ConnectionRegistry(EnvelopeCodec codec, NotificationEnvelopeFactory envelopeFactory, Clock clock) {
        this.codec = codec;
        this.envelopeFactory = envelopeFactory;
        this.clock = clock;
    }

    /**
     * Greets the client on its new channel and registers it. The greeting is queued before the
     * connection becomes visible to broadcasts, so it is always the first frame the client sees.
     * If the greeting cannot be delivered the connection is returned closed and unregistered.
     */
    public ClientConnection connect(String clientId, ClientChannel channel) {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("Client id is required");
        }
        ClientConnection connection = new ClientConnection(clientId, channel, clock.instant());
        String greeting = codec.encode(envelopeFactory.connectionEstablished(clientId));
        if (!deliver(connection, greeting)) {
            connection.close();
            return connection;
        }

        ClientConnection previous;
        int total;
        synchronized (lock) {
            previous = connections.put(clientId, connection);
            total = connections.size();
        }
        if (previous != null) {
            log.info("Client {} reconnected, closing previous connection from {}", clientId, previous.getConnectedAt());
            previous.close();
        }
        log.info("Client {} connected. Active connections: {}", clientId, total);
        return connection;
    }

    public void disconnect(String clientId) {
        ClientConnection removed;
        synchronized (lock) {
            removed = connections.remove(clientId);
        }
        if (removed != null) {
            removed.close();
            log.info("Client {} disconnected", clientId);
        }
    }

    /**
     * Removes the entry only if it still belongs to this exact connection, so that the transport
     * tearing down a replaced session cannot evict its replacement. The channel is closed either way.
     */
    public void release(ClientConnection connection) {
        boolean removed;
        synchronized (lock) {
            removed = connections.remove(connection.getClientId(), connection);
        }
        connection.close();
        if (removed) {
            log.info("Client {} released its connection", connection.getClientId());
        } else {
            log.debug("Connection {} was already replaced or removed", connection);
        }
    }

    public boolean unicast(String clientId, NotificationEnvelope envelope) {
        ClientConnection connection;
        synchronized (lock) {
            connection = connections.get(clientId);
        }
        if (connection == null) {
            log.debug("No connection for client {}, dropping {} envelope", clientId, envelope.getType());
            return false;
        }
        if (deliver(connection, codec.encode(envelope))) {
            return true;
        }
        evict(connection);
        return false;
    }

    /**
     * Delivers one envelope to every registered client.
     *
     * @return the number of clients that accepted the frame
     */
    public int broadcast(NotificationEnvelope envelope) {
        List<ClientConnection> recipients;
        synchronized (lock) {
            if (connections.isEmpty()) {
                return 0;
            }
            recipients = List.copyOf(connections.values());
        }

        String frame = codec.encode(envelope);
        int delivered = 0;
        List<ClientConnection> failed = new ArrayList<>();
        for (ClientConnection connection : recipients) {
            if (deliver(connection, frame)) {
                delivered++;
            } else {
                failed.add(connection);
            }
        }
        failed.forEach(this::evict);
        log.debug("Broadcast {} envelope to {}/{} clients", envelope.getType(), delivered, recipients.size());
        return delivered;
    }

    public boolean subscribe(String clientId, String workflowId) {
        ClientConnection connection;
        synchronized (lock) {
            connection = connections.get(clientId);
        }
        if (connection == null) {
            return false;
        }
        connection.addSubscription(workflowId);
        log.debug("Client {} subscribed to workflow {}", clientId, workflowId);
        return true;
    }

    public int count() {
        synchronized (lock) {
            return connections.size();
        }
    }

    public boolean isConnected(String clientId) {
        synchronized (lock) {
            return connections.containsKey(clientId);
        }
    }

    public List<ConnectionInfo> connections() {
        List<ClientConnection> snapshot;
        synchronized (lock) {
            snapshot = List.copyOf(connections.values());
        }
        return snapshot.stream()
                .sorted(Comparator.comparing(ClientConnection::getConnectedAt).thenComparing(ClientConnection::getClientId))
                .map(c -> new ConnectionInfo(c.getClientId(), c.getConnectedAt(), c.getSubscriptions()))
                .toList();
    }

    public long deliveryFailureCount() {
        return deliveryFailures.get();
    }

    @PreDestroy
    public void closeAll() {
        List<ClientConnection> all;
        synchronized (lock) {
            all = List.copyOf(connections.values());
            connections.clear();
        }
        all.forEach(ClientConnection::close);
        if (!all.isEmpty()) {
            log.info("Closed {} client connections on shutdown", all.size());
        }
    }

    private boolean deliver(ClientConnection connection, String frame) {
        try {
            connection.send(frame);
            return true;
        } catch (RuntimeException e) {
            deliveryFailures.incrementAndGet();
            log.warn("Failed to deliver frame to client {}: {}. Dropping connection.", connection.getClientId(), e.getMessage());
            return false;
        }
    }

    private void evict(ClientConnection connection) {
        synchronized (lock) {
            connections.remove(connection.getClientId(), connection);
        }
        connection.close();
    }
}
