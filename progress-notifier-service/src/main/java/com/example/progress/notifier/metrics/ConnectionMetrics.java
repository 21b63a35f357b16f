package com.example.progress.notifier.metrics;

import com.example.progress.notifier.service.ConnectionRegistry;
import com.example.progress.notifier.service.WorkflowService;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ConnectionMetrics implements MeterBinder {

    private final ConnectionRegistry registry;
    private final WorkflowService workflowService;

    @Override
    public void bindTo(MeterRegistry meterRegistry) {
        Gauge.builder("progress.connections.active", registry, ConnectionRegistry::count)
                .description("Number of connected WebSocket clients")
                .register(meterRegistry);

        FunctionCounter.builder("progress.delivery.failures", registry, ConnectionRegistry::deliveryFailureCount)
                .description("Frames that could not be delivered to a client")
                .register(meterRegistry);

        Gauge.builder("progress.workflows.running", workflowService, WorkflowService::activeCount)
                .description("Workflows that have not reached a terminal state")
                .register(meterRegistry);
    }
}
