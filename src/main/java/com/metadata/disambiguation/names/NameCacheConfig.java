package com.metadata.disambiguation.names;

/**
 * Configuration for the parsed-name cache.
 *
 * @param maxSize maximum number of cached names
 * @param enabled whether caching is enabled
 */
public record NameCacheConfig(int maxSize, boolean enabled) {

    public NameCacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    /**
     * Default configuration: 50,000 names, enabled.
     */
    public static NameCacheConfig defaults() {
        return new NameCacheConfig(50_000, true);
    }

    public static NameCacheConfig disabled() {
        return new NameCacheConfig(1, false);
    }
}
