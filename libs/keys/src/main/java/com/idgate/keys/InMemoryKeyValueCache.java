package com.idgate.keys;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

/**
 * Process-local {@link KeyValueCache} backed by Caffeine, with per-entry expiry.
 * <p>
 * Each entry expires after the TTL given to {@code put}. A {@code put} without a TTL uses the
 * default TTL given at construction; a zero default means such entries never expire.
 */
public final class InMemoryKeyValueCache implements KeyValueCache {

    /** Default time to live for entries stored without an explicit TTL. */
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    private static final long NEVER = Long.MAX_VALUE;

    private final Cache<String, Entry> entries;
    private final Duration defaultTtl;

    public InMemoryKeyValueCache() {
        this(DEFAULT_TTL, Ticker.systemTicker());
    }

    /**
     * @param defaultTtl TTL for entries stored without one; {@link Duration#ZERO} for no expiry
     * @param ticker     time source for expiry
     */
    public InMemoryKeyValueCache(Duration defaultTtl, Ticker ticker) {
        if (defaultTtl == null || defaultTtl.isNegative()) {
            throw new IllegalArgumentException("defaultTtl must not be null or negative");
        }
        if (ticker == null) {
            throw new IllegalArgumentException("ticker must not be null");
        }
        this.defaultTtl = defaultTtl;
        this.entries = Caffeine.newBuilder()
                .ticker(ticker)
                .executor(Runnable::run)
                .expireAfter(new Expiry<String, Entry>() {

                    @Override
                    public long expireAfterCreate(String key, Entry entry, long currentTime) {
                        return entry.ttlNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry entry, long currentTime,
                                                  long currentDuration) {
                        return entry.ttlNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry entry, long currentTime,
                                                long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.getIfPresent(key)).map(Entry::value);
    }

    @Override
    public void put(String key, String value, Duration expirationTtl) {
        if (key == null || value == null) {
            throw new IllegalArgumentException("key and value must not be null");
        }
        Duration ttl = expirationTtl != null ? expirationTtl : defaultTtl;
        entries.put(key, new Entry(value, toNanos(ttl)));
    }

    /** Removes a single entry. */
    public void invalidate(String key) {
        entries.invalidate(key);
    }

    /** Removes all entries. */
    public void clear() {
        entries.invalidateAll();
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    private static long toNanos(Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            return NEVER;
        }
        try {
            return ttl.toNanos();
        } catch (ArithmeticException tooLong) {
            return NEVER;
        }
    }

    private record Entry(String value, long ttlNanos) {}
}
