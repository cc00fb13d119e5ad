package com.metadata.disambiguation.names;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Caffeine-backed decorator that memoizes parsed names.
 * Agent names recur across many works, so the same strings are parsed repeatedly.
 */
public class CachingNameParser implements NameParser {
    private static final Logger log = LoggerFactory.getLogger(CachingNameParser.class);

    private final NameParser delegate;
    private final Cache<String, HumanName> cache;

    public CachingNameParser(NameParser delegate, NameCacheConfig config) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .build();
        log.info("CachingNameParser initialized: maxSize={}", config.maxSize());
    }

    /**
     * Wraps the delegate in a cache when enabled, otherwise returns it unchanged.
     */
    public static NameParser of(NameParser delegate, NameCacheConfig config) {
        return config.enabled() ? new CachingNameParser(delegate, config) : delegate;
    }

    @Override
    public HumanName parse(String name) {
        if (name == null) {
            return HumanName.EMPTY;
        }
        return cache.get(name, delegate::parse);
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public long size() {
        return cache.estimatedSize();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
