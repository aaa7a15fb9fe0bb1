package com.mcpbridge.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for instance lifecycle management.
 */
@Service
public class BridgeMetrics {

    private final MeterRegistry registry;

    public BridgeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordInstanceCreated(String mode) {
        Counter.builder("mcpbridge.instances.created")
                .tag("mode", mode)
                .register(registry)
                .increment();
    }

    public void recordInstanceStopped(String mode) {
        Counter.builder("mcpbridge.instances.stopped")
                .tag("mode", mode)
                .register(registry)
                .increment();
    }

    /**
     * @param reason "spawn", "template", "crash" or "timeout"
     */
    public void recordInstanceFailure(String mode, String reason) {
        Counter.builder("mcpbridge.instances.failed")
                .tag("mode", mode)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAdmissionRejected(String mode, String reason) {
        Counter.builder("mcpbridge.admission.rejected")
                .description("Instance creations refused before spawning")
                .tag("mode", mode)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordStartupDuration(String mode, long ms) {
        Timer.builder("mcpbridge.instances.startup")
                .tag("mode", mode)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordCleanupRemoved(int removed) {
        DistributionSummary.builder("mcpbridge.cleanup.removed")
                .description("Instances removed per cleanup sweep")
                .register(registry)
                .record(removed);
    }
}
