package com.mcpbridge.core.health;

import com.mcpbridge.core.model.InstanceStatus;
import com.mcpbridge.lifecycle.Instance;
import com.mcpbridge.lifecycle.LifecycleManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator over the instance pools.
 * Reports DEGRADED while crashed, errored or timed-out instances are still pooled.
 */
@Component
public class LifecycleHealthIndicator implements HealthIndicator {

    private final LifecycleManager lifecycleManager;

    public LifecycleHealthIndicator(LifecycleManager lifecycleManager) {
        this.lifecycleManager = lifecycleManager;
    }

    @Override
    public Health health() {
        var builder = Health.up();
        lifecycleManager.getInstanceCounts()
                .forEach((mode, count) -> builder.withDetail(mode.value(), count));
        builder.withDetail("running", lifecycleManager.getRunningInstanceCount());

        long failed = lifecycleManager.listActiveInstances().stream()
                .map(Instance::getStatus)
                .filter(InstanceStatus::isFailure)
                .count();
        builder.withDetail("failed", failed);

        return failed > 0 ? builder.status("DEGRADED").build() : builder.build();
    }
}
