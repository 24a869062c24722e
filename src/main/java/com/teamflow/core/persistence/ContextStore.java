package com.teamflow.core.persistence;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable key/value store, namespaced per epic.
 * <p>
 * Values are opaque strings (JSON in practice). A {@code null} TTL means the
 * entry never expires. Expired entries behave exactly like missing ones.
 */
public interface ContextStore {

    void store(String namespace, String key, String value, Duration ttl);

    Optional<String> retrieve(String namespace, String key);

    /** @return true if an entry was removed */
    boolean delete(String namespace, String key);

    /** @return number of removed entries */
    int deleteNamespace(String namespace);

    /** Live keys of a namespace in ascending order. */
    List<String> keys(String namespace);

    /** Lightweight reachability check used by health reporting. */
    boolean isAvailable();
}
