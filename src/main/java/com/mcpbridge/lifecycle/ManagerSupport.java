package com.mcpbridge.lifecycle;

import com.mcpbridge.core.events.EventBus;
import com.mcpbridge.core.metrics.BridgeMetrics;
import com.mcpbridge.core.template.PathTemplateResolver;
import com.mcpbridge.monitoring.InstanceMetricsRecorder;
import com.mcpbridge.process.ProcessLauncher;
import com.mcpbridge.process.ProtocolHandshake;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Collaborators shared by the three scoped managers.
 *
 * @param resolver               template resolution and path validation
 * @param recorder               per-instance sample series
 * @param launcher               child process launcher
 * @param handshake              readiness check run after spawn
 * @param eventBus               lifecycle signal sink
 * @param metrics                Micrometer meters
 * @param executor               runs spawns and stops off the caller's thread
 * @param clock                  time source for access and age bookkeeping
 * @param defaultStartupTimeout  used when a definition carries no timeout
 * @param maxInstancesPerManager live instance ceiling per manager, 0 for none
 */
public record ManagerSupport(
    PathTemplateResolver resolver,
    InstanceMetricsRecorder recorder,
    ProcessLauncher launcher,
    ProtocolHandshake handshake,
    EventBus eventBus,
    BridgeMetrics metrics,
    Executor executor,
    Clock clock,
    Duration defaultStartupTimeout,
    int maxInstancesPerManager
) {}
