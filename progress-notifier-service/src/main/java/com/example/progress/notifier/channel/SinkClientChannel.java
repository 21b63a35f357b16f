package com.example.progress.notifier.channel;

import com.example.progress.shared.exception.ChannelDeliveryException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

/**
 * Channel backed by a unicast Reactor sink whose flux is drained into the WebSocket session.
 * Frames sent before the session subscribes, or faster than the session drains them, are held in a
 * bounded queue; once it is full {@link #send} fails with {@link ChannelDeliveryException}, which
 * makes the registry drop the client. Emission is done under this object's lock because a Reactor
 * sink rejects concurrent emitters instead of queueing them.
 */
@Slf4j
public class SinkClientChannel implements ClientChannel {

    private final Sinks.Many<String> sink;

    private volatile boolean open = true;

    public SinkClientChannel() {
        this(Queues.SMALL_BUFFER_SIZE);
    }

    /**
     * @param bufferSize frames held for a slow session before sends start failing; Reactor may round it up
     */
    public SinkClientChannel(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("Buffer size must be positive: " + bufferSize);
        }
        this.sink = Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(bufferSize).get());
    }

    @Override
    public void send(String frame) {
        Sinks.EmitResult result;
        synchronized (this) {
            if (!open) {
                throw new ChannelDeliveryException("Channel is closed");
            }
            result = sink.tryEmitNext(frame);
        }
        if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
            throw new ChannelDeliveryException("Send buffer full, client is not keeping up");
        }
        if (result.isFailure()) {
            throw new ChannelDeliveryException("Failed to emit frame. Result: " + result);
        }
    }

    @Override
    public void close() {
        synchronized (this) {
            if (!open) {
                return;
            }
            open = false;
            Sinks.EmitResult result = sink.tryEmitComplete();
            if (result.isFailure()) {
                log.debug("Completing channel sink returned {}", result);
            }
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    public Flux<String> frames() {
        return sink.asFlux();
    }
}
