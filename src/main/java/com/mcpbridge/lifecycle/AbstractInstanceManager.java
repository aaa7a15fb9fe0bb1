package com.mcpbridge.lifecycle;

import com.mcpbridge.core.events.LifecycleEvent;
import com.mcpbridge.core.logging.MdcContext;
import com.mcpbridge.core.model.CallerContext;
import com.mcpbridge.core.model.InstanceFilter;
import com.mcpbridge.core.model.InstanceKey;
import com.mcpbridge.core.model.InstanceStatus;
import com.mcpbridge.core.model.ServerDefinition;
import com.mcpbridge.core.template.LaunchTemplate;
import com.mcpbridge.core.template.ResolvedLaunchConfig;
import com.mcpbridge.process.HandshakeException;
import com.mcpbridge.process.LaunchRequest;
import com.mcpbridge.process.ManagedProcess;
import com.mcpbridge.process.ProtocolSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Pool, spawn and reclamation logic shared by the scoped managers.
 * <p>
 * All pool state is guarded by one lock per manager. Three maps describe an identity:
 * <ul>
 *   <li>{@code pool} holds the instance, from {@code STARTING} until it is removed</li>
 *   <li>{@code inFlight} holds the pending creation, so a concurrent caller joins it instead of spawning</li>
 *   <li>{@code stopping} holds the pending stop; while present the identity is never handed out</li>
 * </ul>
 * Spawning, handshakes and termination run on the executor, never while the lock is held.
 */
public abstract class AbstractInstanceManager implements InstanceManager {

    private static final Logger log = LoggerFactory.getLogger(AbstractInstanceManager.class);

    protected final ManagerSupport support;
    protected final CleanupPolicy policy;

    private final Object lock = new Object();
    private final Map<InstanceKey, Instance> pool = new LinkedHashMap<>();
    private final Map<InstanceKey, CompletableFuture<Instance>> inFlight = new HashMap<>();
    private final Map<InstanceKey, CompletableFuture<Void>> stopping = new HashMap<>();

    protected AbstractInstanceManager(ManagerSupport support, CleanupPolicy policy) {
        this.support = support;
        this.policy = policy;
    }

    /**
     * Mode-specific admission rules, checked under the pool lock after the capacity ceilings.
     * Use {@link #liveCount(Predicate)} to count existing instances.
     *
     * @throws AdmissionException to refuse the request
     */
    protected void checkAdmission(InstanceKey key, ServerDefinition definition, CallerContext context) {
    }

    /** Template variables available to this mode's launch strings. */
    protected abstract Map<String, String> variablesFor(CallerContext context);

    /** Identity variables exported to the child process. */
    protected abstract Map<String, String> scopeEnvironment(CallerContext context);

    public CleanupPolicy getPolicy() {
        return policy;
    }

    @Override
    public Optional<Instance> getInstance(InstanceKey key) {
        return getInstance(key, key.userId());
    }

    @Override
    public Optional<Instance> getInstance(InstanceKey key, String accessorId) {
        Instance instance;
        Integer crashCode = null;
        synchronized (lock) {
            if (stopping.containsKey(key)) {
                return Optional.empty();
            }
            instance = pool.get(key);
            if (instance == null) {
                return Optional.empty();
            }
            if (instance.getStatus() == InstanceStatus.RUNNING && !instance.isProcessAlive()) {
                crashCode = markCrashed(instance);
            }
            if (instance.getStatus() == InstanceStatus.RUNNING) {
                instance.touch(support.clock().instant());
            }
        }
        if (crashCode != null) {
            reportCrash(instance, crashCode);
        }
        if (instance.getStatus() != InstanceStatus.RUNNING) {
            return Optional.empty();
        }
        support.recorder().recordAccess(instance.getId(), accessorId);
        return Optional.of(instance);
    }

    @Override
    public CompletableFuture<Instance> createInstance(ServerDefinition definition, CallerContext context) {
        InstanceKey key;
        try {
            key = keyFor(definition, context);
        } catch (AdmissionException e) {
            return reject(e);
        }
        return admit(key, definition, context).thenApply(instance -> {
            support.recorder().recordAccess(instance.getId(), context.userId());
            return instance;
        });
    }

    private CompletableFuture<Instance> admit(InstanceKey key, ServerDefinition definition, CallerContext context) {
        CompletableFuture<Void> pendingStop;
        CompletableFuture<Instance> result = null;
        Instance created = null;
        Instance crashed = null;
        Instance replaced = null;
        Integer crashCode = null;

        synchronized (lock) {
            pendingStop = stopping.get(key);
            if (pendingStop == null) {
                CompletableFuture<Instance> pending = inFlight.get(key);
                if (pending != null) {
                    return pending;
                }

                int retryCount = 0;
                Instance current = pool.get(key);
                if (current != null) {
                    if (current.getStatus() == InstanceStatus.RUNNING && !current.isProcessAlive()) {
                        crashCode = markCrashed(current);
                        crashed = current;
                    }
                    if (current.getStatus() == InstanceStatus.RUNNING) {
                        current.touch(support.clock().instant());
                        return CompletableFuture.completedFuture(current);
                    }
                    if (!definition.autoRestart() || current.getRetryCount() >= definition.maxRetries()) {
                        result = CompletableFuture.failedFuture(new CrashException(key, current.getRetryCount(),
                                "Instance " + current.getId() + " of '" + key.serverName() + "' is "
                                        + current.getStatus() + " after " + current.getRetryCount()
                                        + " restart(s); no further restart is allowed"));
                    } else {
                        retryCount = current.getRetryCount() + 1;
                        pool.remove(key);
                        replaced = current;
                        log.info("Restarting {} after {} (attempt {} of {})",
                                key, current.getStatus(), retryCount, definition.maxRetries());
                    }
                }

                if (result == null) {
                    try {
                        checkCapacity(key, definition);
                        checkAdmission(key, definition, context);
                        created = newInstance(key, definition, context, retryCount);
                        pool.put(key, created);
                        result = new CompletableFuture<>();
                        inFlight.put(key, result);
                    } catch (AdmissionException e) {
                        result = reject(e);
                    }
                }
            }
        }

        if (crashed != null) {
            reportCrash(crashed, crashCode);
        }
        if (replaced != null) {
            support.recorder().removeInstance(replaced.getId());
        }
        if (pendingStop != null) {
            log.debug("Creation of {} waits for a pending stop", key);
            return pendingStop.handle((v, e) -> null)
                    .thenCompose(v -> admit(key, definition, context));
        }
        if (created != null) {
            Instance first = created;
            CompletableFuture<Instance> future = result;
            support.executor().execute(() -> launch(first, future));
        }
        return result;
    }

    private CompletableFuture<Instance> reject(AdmissionException e) {
        log.warn("Admission refused for {} instance: {}", mode().value(), e.getMessage());
        support.metrics().recordAdmissionRejected(mode().value(), e.getReason());
        return CompletableFuture.failedFuture(e);
    }

    private void checkCapacity(InstanceKey key, ServerDefinition definition) {
        Integer perServer = definition.resourceLimits().maxInstances();
        if (perServer != null && liveCount(k -> k.serverName().equals(key.serverName())) >= perServer) {
            throw new AdmissionException(AdmissionException.CAPACITY,
                    "Server '" + key.serverName() + "' reached its limit of " + perServer + " "
                            + mode().value() + " instance(s)");
        }
        int perManager = support.maxInstancesPerManager();
        if (perManager > 0 && liveCount(k -> true) >= perManager) {
            throw new AdmissionException(AdmissionException.CAPACITY,
                    "The " + mode().value() + " pool is full (" + perManager + " instances)");
        }
    }

    /**
     * Counts pooled instances that are starting, running or stopping. Caller must hold the pool lock,
     * which is the case inside {@link #checkAdmission}.
     */
    protected final int liveCount(Predicate<InstanceKey> filter) {
        int count = 0;
        for (var entry : pool.entrySet()) {
            if (!entry.getValue().getStatus().isTerminal() && filter.test(entry.getKey())) {
                count++;
            }
        }
        return count;
    }

    private Instance newInstance(InstanceKey key, ServerDefinition definition, CallerContext context, int retryCount) {
        String id = mode().value() + "_" + definition.name() + "_" + UUID.randomUUID().toString().substring(0, 8);
        return new Instance(id, key, definition, context, support.clock().instant(), retryCount);
    }

    /**
     * Starts the instance, retrying spawn and startup-timeout failures while the definition's
     * restart budget allows.
     */
    private void launch(Instance first, CompletableFuture<Instance> result) {
        Instance instance = first;
        InstanceKey key = instance.getKey();
        ServerDefinition definition = instance.getDefinition();

        while (true) {
            MdcContext.setInstance(key, instance.getId());
            try {
                start(instance);
                synchronized (lock) {
                    instance.setStatus(InstanceStatus.RUNNING);
                    inFlight.remove(key);
                }
                watchExit(instance);
                result.complete(instance);
                return;
            } catch (Exception e) {
                LifecycleException error = classify(instance, e);
                InstanceStatus status = error.getKind() == ErrorKind.TIMEOUT
                        ? InstanceStatus.TIMEOUT
                        : InstanceStatus.ERROR;
                ManagedProcess process = instance.getProcess();
                if (process != null) {
                    process.kill();
                }

                Instance next = null;
                boolean retryable = error.getKind() == ErrorKind.SPAWN || error.getKind() == ErrorKind.TIMEOUT;
                synchronized (lock) {
                    instance.fail(status, error);
                    pool.remove(key, instance);
                    if (retryable && !stopping.containsKey(key)
                            && definition.autoRestart() && instance.getRetryCount() < definition.maxRetries()) {
                        next = newInstance(key, definition, instance.getContext(), instance.getRetryCount() + 1);
                        pool.put(key, next);
                    } else {
                        inFlight.remove(key);
                    }
                }
                support.recorder().removeInstance(instance.getId());
                reportFailure(instance, status, error);

                if (next == null) {
                    result.completeExceptionally(error);
                    return;
                }
                log.info("Retrying {} (attempt {} of {})", key, next.getRetryCount(), definition.maxRetries());
                instance = next;
            } finally {
                MdcContext.clear();
            }
        }
    }

    private void start(Instance instance) throws InterruptedException {
        ServerDefinition definition = instance.getDefinition();
        long started = System.nanoTime();

        ResolvedLaunchConfig resolved = support.resolver()
                .validateAndResolveConfig(LaunchTemplate.from(definition), variablesFor(instance.getContext()));
        if (!resolved.validation().valid()) {
            throw new TemplateValidationException(definition.name(), resolved.validation().errors());
        }
        if (!resolved.validation().warnings().isEmpty()) {
            log.warn("Launch configuration warnings for {}: {}", instance.getId(), resolved.validation().warnings());
        }

        var environment = new LinkedHashMap<>(resolved.config().env());
        environment.putAll(scopeEnvironment(instance.getContext()));
        var request = new LaunchRequest(instance.getId(), definition.name(),
                resolved.config().command(), resolved.config().args(), environment,
                resolved.config().workingDirectory(), definition.uid(), definition.gid());

        ManagedProcess process = support.launcher().launch(request);
        instance.attach(process);
        publish(LifecycleEvent.INSTANCE_CREATED, instance, Map.of("pid", process.getPid()));

        Duration timeout = startupTimeout(definition);
        CompletableFuture<ProtocolSession> handshake =
                CompletableFuture.supplyAsync(() -> support.handshake().perform(process), support.executor());
        try {
            instance.establish(handshake.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            handshake.cancel(true);
            throw new StartupTimeoutException(definition.name(), timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new SpawnException("Handshake failed for '" + definition.name() + "'", cause);
        }

        long elapsedMs = (System.nanoTime() - started) / 1_000_000;
        support.metrics().recordInstanceCreated(mode().value());
        support.metrics().recordStartupDuration(mode().value(), elapsedMs);
        publish(LifecycleEvent.INSTANCE_STARTED, instance, Map.of("pid", process.getPid(), "startupMs", elapsedMs));
        log.info("Instance {} of '{}' running (pid {}, {} ms)", instance.getId(), definition.name(),
                process.getPid(), elapsedMs);
    }

    private Duration startupTimeout(ServerDefinition definition) {
        Integer minutes = definition.resourceLimits().timeoutMinutes();
        return minutes != null && minutes > 0 ? Duration.ofMinutes(minutes) : support.defaultStartupTimeout();
    }

    private static LifecycleException classify(Instance instance, Exception e) {
        if (e instanceof LifecycleException le) {
            return le;
        }
        if (e instanceof HandshakeException) {
            return new SpawnException("Handshake with '" + instance.getServerName() + "' failed: " + e.getMessage(), e);
        }
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new SpawnException("Interrupted while starting '" + instance.getServerName() + "'", e);
        }
        return new SpawnException("Unexpected failure starting '" + instance.getServerName() + "': " + e.getMessage(), e);
    }

    private void watchExit(Instance instance) {
        instance.getProcess().onExit().thenAccept(code -> {
            boolean crashed;
            synchronized (lock) {
                crashed = instance.getStatus() == InstanceStatus.RUNNING && markCrashed(instance) != null;
            }
            if (crashed) {
                reportCrash(instance, code);
            }
        });
    }

    /**
     * Moves a running instance whose process has exited to {@code CRASHED}. Caller holds the lock.
     *
     * @return the exit code, or {@code null} if the instance was not running
     */
    private Integer markCrashed(Instance instance) {
        if (instance.getStatus() != InstanceStatus.RUNNING) {
            return null;
        }
        ManagedProcess process = instance.getProcess();
        Integer code = process != null ? process.getExitCode() : null;
        int exitCode = code != null ? code : -1;
        instance.fail(InstanceStatus.CRASHED, new CrashException(instance.getKey(), instance.getRetryCount(),
                "Process of instance " + instance.getId() + " exited unexpectedly with code " + exitCode));
        return exitCode;
    }

    private void reportCrash(Instance instance, Integer exitCode) {
        if (instance == null) return;
        log.warn("Instance {} of '{}' crashed (exit {})", instance.getId(), instance.getServerName(), exitCode);
        support.metrics().recordInstanceFailure(mode().value(), "crash");
        publish(LifecycleEvent.INSTANCE_CRASHED, instance,
                Map.of("exitCode", exitCode != null ? exitCode : -1, "retryCount", instance.getRetryCount()));
    }

    private void reportFailure(Instance instance, InstanceStatus status, LifecycleException error) {
        String reason = switch (error.getKind()) {
            case TEMPLATE_VALIDATION -> "template";
            case TIMEOUT -> "timeout";
            default -> "spawn";
        };
        log.error("Failed to start instance {} of '{}': {}", instance.getId(), instance.getServerName(), error.getMessage());
        support.metrics().recordInstanceFailure(mode().value(), reason);
        String eventType = status == InstanceStatus.TIMEOUT ? LifecycleEvent.INSTANCE_TIMEOUT : LifecycleEvent.INSTANCE_ERROR;
        publish(eventType, instance, Map.of("error", error.getMessage(), "kind", error.getKind().name()));
    }

    /**
     * {@inheritDoc}
     * <p>
     * A stop issued while the identity is still being created is registered at once, so later
     * lookups and creations wait for it; the termination itself runs once the creation settles.
     */
    @Override
    public CompletableFuture<Void> stopInstance(InstanceKey key) {
        CompletableFuture<Instance> pending;
        CompletableFuture<Void> stop = new CompletableFuture<>();
        Instance instance = null;

        synchronized (lock) {
            CompletableFuture<Void> existing = stopping.get(key);
            if (existing != null) {
                return existing;
            }
            pending = inFlight.get(key);
            if (pending == null) {
                instance = pool.get(key);
                if (instance == null) {
                    return CompletableFuture.completedFuture(null);
                }
                if (!instance.getStatus().isTerminal()) {
                    instance.setStatus(InstanceStatus.STOPPING);
                }
            }
            stopping.put(key, stop);
        }

        if (pending != null) {
            log.debug("Stop of {} waits for its creation", key);
            pending.handle((i, e) -> null)
                    .thenRunAsync(() -> stopCreated(key, stop), support.executor());
            return stop;
        }
        Instance target = instance;
        support.executor().execute(() -> terminate(target, stop));
        return stop;
    }

    /** Terminates whatever the settled creation left in the pool. */
    private void stopCreated(InstanceKey key, CompletableFuture<Void> stop) {
        Instance instance;
        synchronized (lock) {
            instance = pool.get(key);
            if (instance == null) {
                stopping.remove(key, stop);
            } else if (!instance.getStatus().isTerminal()) {
                instance.setStatus(InstanceStatus.STOPPING);
            }
        }
        if (instance == null) {
            stop.complete(null);
            return;
        }
        terminate(instance, stop);
    }

    private void terminate(Instance instance, CompletableFuture<Void> future) {
        InstanceKey key = instance.getKey();
        MdcContext.setInstance(key, instance.getId());
        try {
            log.info("Stopping instance {} of '{}'", instance.getId(), instance.getServerName());
            ManagedProcess process = instance.getProcess();
            boolean forced = process != null && process.terminate(policy.forcedGrace());

            synchronized (lock) {
                if (!instance.getStatus().isTerminal()) {
                    instance.setStatus(InstanceStatus.STOPPED);
                }
                pool.remove(key, instance);
                stopping.remove(key, future);
            }
            support.recorder().removeInstance(instance.getId());
            support.metrics().recordInstanceStopped(mode().value());
            publish(LifecycleEvent.INSTANCE_STOPPED, instance,
                    Map.of("forced", forced, "status", instance.getStatus().name()));
            log.info("Instance {} stopped{}", instance.getId(), forced ? " (forced)" : "");
            future.complete(null);
        } catch (RuntimeException e) {
            synchronized (lock) {
                stopping.remove(key, future);
            }
            log.error("Error stopping instance {}: {}", instance.getId(), e.getMessage(), e);
            future.completeExceptionally(
                    new CleanupException("Failed to stop instance " + instance.getId(), e));
        } finally {
            MdcContext.clear();
        }
    }

    @Override
    public List<Instance> listInstances(InstanceFilter filter) {
        InstanceFilter effective = filter != null ? filter : InstanceFilter.any();
        synchronized (lock) {
            var result = new ArrayList<Instance>();
            for (var entry : pool.entrySet()) {
                if (effective.matches(entry.getKey())) {
                    result.add(entry.getValue());
                }
            }
            return result;
        }
    }

    @Override
    public CompletableFuture<Integer> cleanup() {
        Instant now = support.clock().instant();
        var targets = new ArrayList<InstanceKey>();
        var crashed = new LinkedHashMap<Instance, Integer>();

        synchronized (lock) {
            for (var entry : pool.entrySet()) {
                InstanceKey key = entry.getKey();
                Instance instance = entry.getValue();
                if (stopping.containsKey(key) || inFlight.containsKey(key)) {
                    continue;
                }
                if (instance.getStatus() == InstanceStatus.RUNNING && !instance.isProcessAlive()) {
                    crashed.put(instance, markCrashed(instance));
                }

                InstanceStatus status = instance.getStatus();
                if (status.isFailure()) {
                    log.debug("Reaping {} instance {}", status, instance.getId());
                    targets.add(key);
                } else if (status == InstanceStatus.RUNNING) {
                    Duration idle = Duration.between(instance.getLastAccessed(), now);
                    Duration age = Duration.between(instance.getCreatedAt(), now);
                    if (idle.compareTo(policy.idleTimeout()) > 0) {
                        log.info("Cleaning up idle instance {} (idle {})", instance.getId(), idle);
                        targets.add(key);
                    } else if (age.compareTo(policy.maxAge()) > 0) {
                        log.info("Cleaning up expired instance {} (age {})", instance.getId(), age);
                        targets.add(key);
                    }
                }
            }
        }
        crashed.forEach(this::reportCrash);

        if (targets.isEmpty()) {
            return CompletableFuture.completedFuture(0);
        }

        List<CompletableFuture<Boolean>> stops = new ArrayList<>();
        for (InstanceKey key : targets) {
            stops.add(stopInstance(key).handle((v, e) -> {
                if (e != null) {
                    log.warn("Cleanup could not stop {}: {}", key, e.getMessage());
                    return false;
                }
                return true;
            }));
        }
        return CompletableFuture.allOf(stops.toArray(CompletableFuture[]::new)).thenApply(v -> {
            int removed = (int) stops.stream().filter(CompletableFuture::join).count();
            log.info("Cleaned up {} {} instance(s)", removed, mode().value());
            return removed;
        });
    }

    @Override
    public int getInstanceCount() {
        synchronized (lock) {
            return pool.size();
        }
    }

    @Override
    public int getRunningInstanceCount() {
        synchronized (lock) {
            return (int) pool.values().stream()
                    .filter(i -> i.getStatus() == InstanceStatus.RUNNING)
                    .count();
        }
    }

    @Override
    public CompletableFuture<Void> shutdown() {
        List<InstanceKey> keys;
        synchronized (lock) {
            keys = new ArrayList<>(pool.keySet());
            keys.addAll(inFlight.keySet());
        }
        log.info("Shutting down {} {} instance(s)", keys.size(), mode().value());
        return CompletableFuture.allOf(keys.stream()
                .distinct()
                .map(k -> stopInstance(k).exceptionally(e -> null))
                .toArray(CompletableFuture[]::new));
    }

    private void publish(String eventType, Instance instance, Map<String, Object> details) {
        var payload = new HashMap<String, Object>(details);
        payload.put("mode", mode().value());
        payload.put("key", instance.getKey().toString());
        support.eventBus().publish(LifecycleEvent.of(eventType, instance.getServerName(), instance.getId(), payload));
    }
}
