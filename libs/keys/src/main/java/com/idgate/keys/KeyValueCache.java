package com.idgate.keys;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store used to keep the provider's key set between requests.
 * <p>
 * Supplied by the host environment (an edge KV namespace, Redis, a local map). Implementations
 * must make each {@code get} and {@code put} atomic per key; nothing else is assumed.
 */
public interface KeyValueCache {

    /**
     * Reads a value.
     *
     * @param key the cache key
     * @return the stored value, or empty if absent or expired
     */
    Optional<String> get(String key);

    /**
     * Stores a value, replacing any previous one.
     *
     * @param key           the cache key
     * @param value         the value to store
     * @param expirationTtl time to live, or {@code null} to use the implementation's default
     */
    void put(String key, String value, Duration expirationTtl);
}
