package com.teamflow.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for coordination events.
 * <p>
 * Subscribers either follow one epic or receive everything. A subscriber that
 * throws never prevents delivery to the others.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<TeamflowEvent>>> epicSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<TeamflowEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(TeamflowEvent event) {
        log.debug("Publishing {} for epic {} issue {}", event.eventType(), event.epicId(), event.issueId());

        if (event.epicId() != null) {
            List<Consumer<TeamflowEvent>> subs = epicSubscribers.get(event.epicId());
            if (subs != null) {
                for (Consumer<TeamflowEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }
        for (Consumer<TeamflowEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one epic.
     *
     * @return a handle to cancel the subscription
     */
    public Subscription subscribe(String epicId, Consumer<TeamflowEvent> consumer) {
        epicSubscribers.computeIfAbsent(epicId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<TeamflowEvent>> subs = epicSubscribers.get(epicId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<TeamflowEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<TeamflowEvent> subscriber, TeamflowEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed on {}: {}", event.eventType(), e.getMessage(), e);
        }
    }
}
