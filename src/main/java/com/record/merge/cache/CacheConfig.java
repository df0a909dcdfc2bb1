package com.record.merge.cache;

/**
 * Configuration for the alias redirect cache.
 *
 * @param maxSize    maximum number of cached redirects
 * @param ttlSeconds time-to-live in seconds for each redirect
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 10,000 redirects, 600s TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, 600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
