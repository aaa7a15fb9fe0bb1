package com.mcpbridge.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Delivers lifecycle signals from the instance managers and the cleanup sweeper.
 * <p>
 * Subscribers choose one of three scopes: every signal of one server definition, every signal
 * of some event types (e.g. the resource monitor only follows start, stop and crash), or
 * everything. A signal reaching a subscriber through two scopes is delivered twice.
 * Delivery is synchronous on the publishing thread; a subscriber that throws is logged and
 * skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<LifecycleEvent>>> byServer =
            new ConcurrentHashMap<>();

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<LifecycleEvent>>> byType =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<LifecycleEvent>> everything = new CopyOnWriteArrayList<>();

    /**
     * Publishes a signal to its server's, its type's and the global subscribers.
     *
     * @return the number of deliveries attempted
     */
    public int publish(LifecycleEvent event) {
        if (event.isFailure()) {
            log.debug("Lifecycle signal {} for instance {} of '{}': {}",
                    event.eventType(), event.instanceId(), event.serverName(), event.payload());
        } else {
            log.debug("Lifecycle signal {} for instance {} of '{}'",
                    event.eventType(), event.instanceId(), event.serverName());
        }

        int delivered = 0;
        if (event.serverName() != null) {
            delivered += deliverAll(byServer.get(event.serverName()), event);
        }
        delivered += deliverAll(byType.get(event.eventType()), event);
        delivered += deliverAll(everything, event);
        return delivered;
    }

    /**
     * Follows every signal of one server definition. Sweeper signals carry no server and are
     * never delivered here.
     */
    public Subscription subscribe(String serverName, Consumer<LifecycleEvent> consumer) {
        byServer.computeIfAbsent(serverName, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to lifecycle signals of server '{}'", serverName);
        return () -> removeFrom(byServer, serverName, consumer);
    }

    /**
     * Follows only the given event types, e.g. {@link LifecycleEvent#INSTANCE_STARTED}.
     */
    public Subscription subscribeTo(Collection<String> eventTypes, Consumer<LifecycleEvent> consumer) {
        Set<String> types = Set.copyOf(eventTypes);
        for (String type : types) {
            byType.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>()).add(consumer);
        }
        log.debug("Subscribed to lifecycle signals {}", types);
        return () -> types.forEach(type -> removeFrom(byType, type, consumer));
    }

    /** Follows every signal. */
    public Subscription subscribeAll(Consumer<LifecycleEvent> consumer) {
        everything.add(consumer);
        log.debug("Subscribed to all lifecycle signals");
        return () -> everything.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static void removeFrom(ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<LifecycleEvent>>> index,
                                   String name, Consumer<LifecycleEvent> consumer) {
        CopyOnWriteArrayList<Consumer<LifecycleEvent>> subs = index.get(name);
        if (subs != null) {
            subs.remove(consumer);
        }
    }

    private int deliverAll(List<Consumer<LifecycleEvent>> subscribers, LifecycleEvent event) {
        if (subscribers == null) {
            return 0;
        }
        for (Consumer<LifecycleEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (Exception e) {
                log.warn("Subscriber failed on {} for instance {}: {}",
                        event.eventType(), event.instanceId(), e.getMessage(), e);
            }
        }
        return subscribers.size();
    }
}
