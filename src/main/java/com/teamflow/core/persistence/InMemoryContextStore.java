package com.teamflow.core.persistence;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-local {@link ContextStore}. State is lost on restart.
 */
public class InMemoryContextStore implements ContextStore {

    private record Entry(String value, Instant expiresAt) {
        boolean expired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }

    private final Map<String, ConcurrentSkipListMap<String, Entry>> namespaces = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryContextStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void store(String namespace, String key, String value, Duration ttl) {
        Instant expiresAt = ttl == null ? null : clock.instant().plus(ttl);
        namespaces.computeIfAbsent(namespace, k -> new ConcurrentSkipListMap<>()).put(key, new Entry(value, expiresAt));
    }

    @Override
    public Optional<String> retrieve(String namespace, String key) {
        var entries = namespaces.get(namespace);
        if (entries == null) {
            return Optional.empty();
        }
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public boolean delete(String namespace, String key) {
        var entries = namespaces.get(namespace);
        return entries != null && entries.remove(key) != null;
    }

    @Override
    public int deleteNamespace(String namespace) {
        var removed = namespaces.remove(namespace);
        return removed == null ? 0 : removed.size();
    }

    @Override
    public List<String> keys(String namespace) {
        var entries = namespaces.get(namespace);
        if (entries == null) {
            return List.of();
        }
        Instant now = clock.instant();
        entries.entrySet().removeIf(e -> e.getValue().expired(now));
        return List.copyOf(entries.keySet());
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
