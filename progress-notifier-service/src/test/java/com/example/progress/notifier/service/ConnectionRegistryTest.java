package com.example.progress.notifier.service;

import com.example.progress.notifier.channel.RecordingChannel;
import com.example.progress.notifier.channel.SinkClientChannel;
import com.example.progress.notifier.dto.ConnectionInfo;
import com.example.progress.notifier.model.ClientConnection;
import com.example.progress.shared.codec.EnvelopeCodec;
import com.example.progress.shared.dto.NotificationEnvelope;
import com.example.progress.shared.util.Constants.EnvelopeType;
import com.example.progress.shared.util.MonotonicClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionRegistryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private NotificationEnvelopeFactory envelopes;
    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        envelopes = new NotificationEnvelopeFactory(MonotonicClock.systemUTC());
        registry = new ConnectionRegistry(new EnvelopeCodec(objectMapper), envelopes, Clock.systemUTC());
    }

    @Test
    void connectGreetsClientBeforeAnythingElse() throws Exception {
        RecordingChannel channel = new RecordingChannel();

        registry.connect("c1", channel);
        registry.broadcast(envelopes.pong());

        assertThat(channel.frames()).hasSize(2);
        JsonNode greeting = objectMapper.readTree(channel.frames().get(0));
        assertThat(greeting.get("type").asText()).isEqualTo("connection");
        assertThat(greeting.get("client_id").asText()).isEqualTo("c1");
        assertThat(greeting.get("status").asText()).isEqualTo("connected");
        assertThat(registry.count()).isEqualTo(1);
    }

    @Test
    void clientThatStopsDrainingIsEvictedWhenItsBufferOverflows() {
        SinkClientChannel stalled = new SinkClientChannel(8);
        RecordingChannel healthy = new RecordingChannel();
        registry.connect("slow", stalled);
        registry.connect("fast", healthy);

        // greeting plus seven pongs fill the buffer, the eighth overflows
        for (int i = 0; i < 8; i++) {
            registry.broadcast(envelopes.pong());
        }

        assertThat(registry.isConnected("slow")).isFalse();
        assertThat(stalled.isOpen()).isFalse();
        assertThat(registry.isConnected("fast")).isTrue();
        assertThat(healthy.frames()).hasSize(9);
        assertThat(registry.deliveryFailureCount()).isEqualTo(1);
    }

    @Test
    void reconnectReplacesAndClosesPreviousConnection() {
        RecordingChannel first = new RecordingChannel();
        RecordingChannel second = new RecordingChannel();

        registry.connect("c1", first);
        registry.connect("c1", second);
        int delivered = registry.broadcast(envelopes.pong());

        assertThat(registry.count()).isEqualTo(1);
        assertThat(delivered).isEqualTo(1);
        assertThat(first.isOpen()).isFalse();
        assertThat(first.frames()).hasSize(1);
        assertThat(second.frames()).hasSize(2);
    }

    @Test
    void lateReleaseOfReplacedConnectionKeepsReplacement() {
        ClientConnection stale = registry.connect("c1", new RecordingChannel());
        RecordingChannel current = new RecordingChannel();
        registry.connect("c1", current);

        registry.release(stale);

        assertThat(registry.isConnected("c1")).isTrue();
        assertThat(current.isOpen()).isTrue();
    }

    @Test
    void disconnectIsIdempotent() {
        RecordingChannel channel = new RecordingChannel();
        registry.connect("c1", channel);

        registry.disconnect("c1");
        registry.disconnect("c1");
        registry.disconnect("never-connected");

        assertThat(registry.count()).isZero();
        assertThat(channel.isOpen()).isFalse();
        assertThat(channel.closeCount()).isEqualTo(1);
    }

    @Test
    void broadcastIsolatesFailingRecipient() {
        RecordingChannel a = new RecordingChannel();
        RecordingChannel b = new RecordingChannel();
        RecordingChannel c = new RecordingChannel();
        registry.connect("a", a);
        registry.connect("b", b);
        registry.connect("c", c);
        b.breakChannel();

        int delivered = registry.broadcast(envelopes.pong());

        assertThat(delivered).isEqualTo(2);
        assertThat(registry.count()).isEqualTo(2);
        assertThat(registry.isConnected("b")).isFalse();
        assertThat(a.frames()).hasSize(2);
        assertThat(c.frames()).hasSize(2);
        assertThat(registry.deliveryFailureCount()).isEqualTo(1);
    }

    @Test
    void broadcastWithoutClientsDoesNotEvenEncode() {
        // An envelope without a type cannot be encoded, so reaching the codec would throw
        NotificationEnvelope unencodable = NotificationEnvelope.builder().timestamp(1L).build();

        assertThat(registry.broadcast(unencodable)).isZero();
        assertThat(registry.count()).isZero();
    }

    @Test
    void unicastToUnknownClientIsSilentNoOp() {
        assertThat(registry.unicast("ghost", envelopes.pong())).isFalse();
        assertThat(registry.deliveryFailureCount()).isZero();
    }

    @Test
    void unicastFailureRemovesOnlyThatClient() {
        RecordingChannel a = new RecordingChannel();
        RecordingChannel b = new RecordingChannel();
        registry.connect("a", a);
        registry.connect("b", b);
        a.breakChannel();

        assertThat(registry.unicast("a", envelopes.pong())).isFalse();
        assertThat(registry.unicast("b", envelopes.pong())).isTrue();

        assertThat(registry.isConnected("a")).isFalse();
        assertThat(registry.isConnected("b")).isTrue();
    }

    @Test
    void connectionWhoseGreetingFailsIsNeverRegistered() {
        RecordingChannel broken = RecordingChannel.broken();

        registry.connect("c1", broken);

        assertThat(registry.count()).isZero();
        assertThat(broken.isOpen()).isFalse();
    }

    @Test
    void subscriptionsAreVisibleInConnectionSnapshot() {
        registry.connect("c1", new RecordingChannel());

        assertThat(registry.subscribe("c1", "job_42")).isTrue();
        assertThat(registry.subscribe("ghost", "job_42")).isFalse();

        List<ConnectionInfo> connections = registry.connections();
        assertThat(connections).hasSize(1);
        assertThat(connections.get(0).getClientId()).isEqualTo("c1");
        assertThat(connections.get(0).getSubscriptions()).containsExactly("job_42");
    }

    @Test
    void closeAllClosesEveryChannel() {
        RecordingChannel a = new RecordingChannel();
        RecordingChannel b = new RecordingChannel();
        registry.connect("a", a);
        registry.connect("b", b);

        registry.closeAll();

        assertThat(registry.count()).isZero();
        assertThat(a.isOpen()).isFalse();
        assertThat(b.isOpen()).isFalse();
    }

    @Test
    void concurrentBroadcastsKeepEachSendersOrderPerClient() throws Exception {
        List<RecordingChannel> channels = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            RecordingChannel channel = new RecordingChannel();
            channels.add(channel);
            registry.connect("client-" + i, channel);
        }
        int senders = 4;
        int perSender = 200;
        ExecutorService executor = Executors.newFixedThreadPool(senders);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int s = 0; s < senders; s++) {
                String sender = "job_" + s;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int seq = 0; seq < perSender; seq++) {
                        registry.broadcast(envelopes.stageStarted(sender, "u", "stage-" + seq, null, seq));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        for (RecordingChannel channel : channels) {
            List<String> frames = channel.frames();
            assertThat(frames).hasSize(1 + senders * perSender);
            int[] lastSeen = new int[senders];
            java.util.Arrays.fill(lastSeen, -1);
            for (String frame : frames.subList(1, frames.size())) {
                JsonNode json = objectMapper.readTree(frame);
                assertThat(json.get("type").asText()).isEqualTo(EnvelopeType.AGENT_STATUS.wireName());
                int sender = Integer.parseInt(json.get("workflow_id").asText().substring("job_".length()));
                int seq = json.get("progress_percentage").asInt();
                assertThat(seq).isEqualTo(lastSeen[sender] + 1);
                lastSeen[sender] = seq;
            }
        }
    }
}
