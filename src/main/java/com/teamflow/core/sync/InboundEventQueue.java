package com.teamflow.core.sync;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.teamflow.core.error.StaleEventException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Decouples tracker events from coordination logic.
 * <p>
 * Events for the same issue number run one after another in arrival order;
 * events for different issues run in parallel. Event ids already seen are dropped.
 */
@Component
public class InboundEventQueue {

    private static final Logger log = LoggerFactory.getLogger(InboundEventQueue.class);
    private static final int MAX_REMEMBERED_IDS = 10_000;

    private final TrackerEventHandler handler;
    private final ExecutorService executor;
    private final Map<Integer, CompletableFuture<Boolean>> tails = new ConcurrentHashMap<>();
    private final Cache<String, Boolean> seen = Caffeine.newBuilder()
            .maximumSize(MAX_REMEMBERED_IDS)
            .build();

    @Autowired
    public InboundEventQueue(TrackerEventHandler handler) {
        this(handler, Executors.newFixedThreadPool(4, r -> {
            Thread t = new Thread(r, "tracker-events");
            t.setDaemon(true);
            return t;
        }));
    }

    InboundEventQueue(TrackerEventHandler handler, ExecutorService executor) {
        this.handler = handler;
        this.executor = executor;
    }

    /**
     * Queues an event.
     *
     * @return completes with {@code true} when the event was applied, {@code false} when it
     *         was a duplicate, stale or failed
     */
    public CompletableFuture<Boolean> submit(TrackerEvent event) {
        if (event.eventId() != null && seen.asMap().putIfAbsent(event.eventId(), Boolean.TRUE) != null) {
            log.debug("Dropping duplicate tracker event {}", event.eventId());
            return CompletableFuture.completedFuture(false);
        }
        int number = event.issueNumber();
        CompletableFuture<Boolean> next = tails.compute(number, (n, tail) ->
                (tail == null ? CompletableFuture.completedFuture(true) : tail)
                        .thenApplyAsync(previous -> process(event), executor));
        next.whenComplete((r, e) -> tails.remove(number, next));
        return next;
    }

    public int pendingIssues() {
        return tails.size();
    }

    private boolean process(TrackerEvent event) {
        try {
            handler.handle(event);
            return true;
        } catch (StaleEventException e) {
            log.debug("Dropping stale tracker event {}: {}", event.eventId(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to apply tracker event {} ({} #{})", event.eventId(), event.type(),
                    event.issueNumber(), e);
            return false;
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
