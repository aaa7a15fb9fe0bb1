package com.mcpbridge.core.health;

import com.mcpbridge.core.model.InstanceStatus;
import com.mcpbridge.core.model.LifecycleMode;
import com.mcpbridge.lifecycle.Instance;
import com.mcpbridge.lifecycle.LifecycleManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LifecycleHealthIndicatorTest {

    private LifecycleManager lifecycleManager;
    private LifecycleHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        lifecycleManager = mock(LifecycleManager.class);
        indicator = new LifecycleHealthIndicator(lifecycleManager);
        when(lifecycleManager.getInstanceCounts()).thenReturn(Map.of(
                LifecycleMode.GLOBAL, 1, LifecycleMode.USER, 2, LifecycleMode.SESSION, 0));
    }

    private static Instance instanceIn(InstanceStatus status) {
        Instance instance = mock(Instance.class);
        when(instance.getStatus()).thenReturn(status);
        return instance;
    }

    @Test
    @DisplayName("All instances healthy -> UP with per-mode counts")
    void upWhenHealthy() {
        when(lifecycleManager.getRunningInstanceCount()).thenReturn(3);
        List<Instance> instances = List.of(
                instanceIn(InstanceStatus.RUNNING), instanceIn(InstanceStatus.RUNNING),
                instanceIn(InstanceStatus.STARTING));
        when(lifecycleManager.listActiveInstances()).thenReturn(instances);

        var health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(1, health.getDetails().get("global"));
        assertEquals(2, health.getDetails().get("user"));
        assertEquals(3, health.getDetails().get("running"));
        assertEquals(0L, health.getDetails().get("failed"));
    }

    @Test
    @DisplayName("Crashed instance still pooled -> DEGRADED")
    void degradedWhenFailuresPooled() {
        List<Instance> instances = List.of(
                instanceIn(InstanceStatus.RUNNING), instanceIn(InstanceStatus.CRASHED),
                instanceIn(InstanceStatus.TIMEOUT));
        when(lifecycleManager.listActiveInstances()).thenReturn(instances);

        var health = indicator.health();

        assertEquals("DEGRADED", health.getStatus().getCode());
        assertEquals(2L, health.getDetails().get("failed"));
    }
}
