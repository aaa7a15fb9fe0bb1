package com.mcpbridge.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle signal emitted by the instance managers, the sweeper or the monitor.
 *
 * @param eventType  event type (e.g. "instance.started", "cleanup.completed")
 * @param serverName the server this event belongs to (nullable for sweeper-level events)
 * @param instanceId the instance this event relates to (nullable for sweeper-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record LifecycleEvent(
    String eventType,
    String serverName,
    String instanceId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String INSTANCE_CREATED = "instance.created";
    public static final String INSTANCE_STARTED = "instance.started";
    public static final String INSTANCE_STOPPED = "instance.stopped";
    public static final String INSTANCE_ERROR = "instance.error";
    public static final String INSTANCE_CRASHED = "instance.crashed";
    public static final String INSTANCE_TIMEOUT = "instance.timeout";
    public static final String CLEANUP_STARTED = "cleanup.started";
    public static final String CLEANUP_COMPLETED = "cleanup.completed";
    public static final String CLEANUP_ERROR = "cleanup.error";

    public static LifecycleEvent of(String eventType, String serverName, String instanceId,
                                    Map<String, Object> payload) {
        return new LifecycleEvent(eventType, serverName, instanceId, payload, Instant.now());
    }

    /** True for signals that report an instance or sweep going wrong. */
    public boolean isFailure() {
        return INSTANCE_ERROR.equals(eventType) || INSTANCE_CRASHED.equals(eventType)
                || INSTANCE_TIMEOUT.equals(eventType) || CLEANUP_ERROR.equals(eventType);
    }
}
