package com.mcpbridge.lifecycle;

import com.mcpbridge.core.model.CallerContext;
import com.mcpbridge.core.model.InstanceKey;
import com.mcpbridge.core.model.InstanceStatus;
import com.mcpbridge.core.model.ServerDefinition;
import com.mcpbridge.process.ManagedProcess;
import com.mcpbridge.process.ProtocolSession;

import java.time.Instant;
import java.util.Objects;

/**
 * A backend process instance and its bookkeeping.
 * <p>
 * Only the scoped manager that created an instance mutates it; everything else reads.
 * Mutators are therefore package-private.
 */
public class Instance {

    private final String id;
    private final InstanceKey key;
    private final ServerDefinition definition;
    private final CallerContext context;
    private final Instant createdAt;
    private final int retryCount;
    private final InstanceStats stats = new InstanceStats();

    private volatile InstanceStatus status = InstanceStatus.STARTING;
    private volatile Instant lastAccessed;
    private volatile ManagedProcess process;
    private volatile ProtocolSession session;
    private volatile LifecycleException lastError;

    Instance(String id, InstanceKey key, ServerDefinition definition, CallerContext context,
             Instant createdAt, int retryCount) {
        this.id = Objects.requireNonNull(id, "id");
        this.key = Objects.requireNonNull(key, "key");
        this.definition = Objects.requireNonNull(definition, "definition");
        this.context = context;
        this.createdAt = createdAt;
        this.lastAccessed = createdAt;
        this.retryCount = retryCount;
    }

    public String getId() {
        return id;
    }

    public String getServerName() {
        return key.serverName();
    }

    public InstanceKey getKey() {
        return key;
    }

    public ServerDefinition getDefinition() {
        return definition;
    }

    public CallerContext getContext() {
        return context;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastAccessed() {
        return lastAccessed;
    }

    public InstanceStatus getStatus() {
        return status;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public InstanceStats getStats() {
        return stats;
    }

    public ProtocolSession getSession() {
        return session;
    }

    public LifecycleException getLastError() {
        return lastError;
    }

    /**
     * @return the process id, or {@code null} before the process is started
     */
    public Long getPid() {
        ManagedProcess p = process;
        return p != null ? p.getPid() : null;
    }

    /** The owned process. Package-private: only the owning manager may terminate it. */
    ManagedProcess getProcess() {
        return process;
    }

    boolean isProcessAlive() {
        ManagedProcess p = process;
        return p != null && p.isAlive();
    }

    void attach(ManagedProcess process) {
        this.process = process;
    }

    void establish(ProtocolSession session) {
        this.session = session;
    }

    void setStatus(InstanceStatus status) {
        this.status = status;
    }

    void fail(InstanceStatus status, LifecycleException error) {
        this.status = status;
        this.lastError = error;
        stats.recordError();
    }

    void touch(Instant now) {
        this.lastAccessed = now;
        stats.recordRequest(now);
    }

    @Override
    public String toString() {
        return "Instance{" +
                "id='" + id + '\'' +
                ", key=" + key +
                ", status=" + status +
                ", retryCount=" + retryCount +
                '}';
    }
}
