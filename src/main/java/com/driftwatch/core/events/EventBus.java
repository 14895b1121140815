package com.driftwatch.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for pipeline events.
 * <p>
 * One process drives one run at a time, so every subscriber sees every event
 * and filters on {@link PipelineEvent#runId()} itself if it needs to. A
 * subscriber that throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final List<Consumer<PipelineEvent>> subscribers = new CopyOnWriteArrayList<>();

    public void publish(PipelineEvent event) {
        log.debug("Publishing {} for run {} (stage={})", event.eventType(), event.runId(), event.stage());
        for (Consumer<PipelineEvent> subscriber : subscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Registers a subscriber for all events.
     *
     * @return a handle that removes this subscriber again
     */
    public Subscription subscribe(Consumer<PipelineEvent> consumer) {
        subscribers.add(consumer);
        return () -> subscribers.remove(consumer);
    }

    int subscriberCount() {
        return subscribers.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<PipelineEvent> subscriber, PipelineEvent event) {
        try {
            subscriber.accept(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on {} for run {}: {}", event.eventType(), event.runId(), e.getMessage(), e);
        }
    }
}
