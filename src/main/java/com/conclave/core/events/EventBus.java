package com.conclave.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Synchronous in-process pub/sub for run and task events.
 * <p>
 * Events are delivered on the publishing thread, in subscription order. The engine publishes
 * from worker and admission threads, so subscribers must be thread-safe and quick. A failing
 * subscriber is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private record Listener(Predicate<ConclaveEvent> filter, Consumer<ConclaveEvent> consumer) {}

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    public void publish(ConclaveEvent event) {
        log.debug("{} run={} task={}", event.eventType(), event.runId(), event.taskId());
        for (Listener listener : listeners) {
            if (listener.filter().test(event)) {
                deliver(listener, event);
            }
        }
    }

    /**
     * Subscribes to the events accepted by {@code filter}.
     *
     * @return handle that removes this subscription
     */
    public Subscription subscribe(Predicate<ConclaveEvent> filter, Consumer<ConclaveEvent> consumer) {
        var listener = new Listener(Objects.requireNonNull(filter), Objects.requireNonNull(consumer));
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /** Subscribes to the events of one run. */
    public Subscription subscribe(String runId, Consumer<ConclaveEvent> consumer) {
        return subscribe(event -> runId.equals(event.runId()), consumer);
    }

    /** Subscribes to every event of every run. */
    public Subscription subscribeAll(Consumer<ConclaveEvent> consumer) {
        return subscribe(event -> true, consumer);
    }

    public int subscriberCount() {
        return listeners.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliver(Listener listener, ConclaveEvent event) {
        try {
            listener.consumer().accept(event);
        } catch (RuntimeException e) {
            log.warn("Event subscriber failed on {} for run {}: {}", event.eventType(), event.runId(),
                    e.getMessage(), e);
        }
    }
}
