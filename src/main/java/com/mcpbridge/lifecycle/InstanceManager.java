package com.mcpbridge.lifecycle;

import com.mcpbridge.core.model.CallerContext;
import com.mcpbridge.core.model.InstanceFilter;
import com.mcpbridge.core.model.InstanceKey;
import com.mcpbridge.core.model.LifecycleMode;
import com.mcpbridge.core.model.ServerDefinition;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Pool of instances for one lifecycle mode. Implementations differ only in how the
 * identity key is derived and in their admission rules.
 */
public interface InstanceManager {

    LifecycleMode mode();

    /**
     * Derives the identity key of a request.
     *
     * @throws AdmissionException if the caller lacks an identity field this mode requires
     */
    InstanceKey keyFor(ServerDefinition definition, CallerContext context);

    /**
     * Returns the running instance for the key and records the access. Never spawns.
     */
    Optional<Instance> getInstance(InstanceKey key);

    /**
     * Same as {@link #getInstance(InstanceKey)}, attributing the access to the calling user.
     * A global instance's key carries no user, so the caller is named separately.
     */
    Optional<Instance> getInstance(InstanceKey key, String accessorId);

    /**
     * Returns the usable instance for the request's identity, spawning one if needed.
     * Concurrent calls for one identity share a single spawn. Every successful call records
     * one access for the caller.
     * <p>
     * Completes exceptionally with a {@link LifecycleException}.
     */
    CompletableFuture<Instance> createInstance(ServerDefinition definition, CallerContext context);

    /**
     * Stops and removes the instance for the key. Completes normally when there is none.
     */
    CompletableFuture<Void> stopInstance(InstanceKey key);

    List<Instance> listInstances(InstanceFilter filter);

    /**
     * Stops every idle, expired or dead instance.
     *
     * @return the number of instances removed; never completes exceptionally for a single
     *         instance's failure
     */
    CompletableFuture<Integer> cleanup();

    int getInstanceCount();

    int getRunningInstanceCount();

    /** Stops every pooled instance. */
    CompletableFuture<Void> shutdown();
}
