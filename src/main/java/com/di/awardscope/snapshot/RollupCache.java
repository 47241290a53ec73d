package com.di.awardscope.snapshot;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Cache-in-front of rollup file reads. Keys include the snapshot version, so tables of a
 * swapped-out version are never served for the new one and simply expire.
 */
@Component
public class RollupCache {

    private final Cache<String, RollupTable> tables;

    public RollupCache(SnapshotProperties props) {
        this.tables = Caffeine.newBuilder()
                .maximumSize(props.getRollupCacheMaxSize())
                .expireAfterAccess(props.getRollupCacheExpireAfterAccessMinutes(), TimeUnit.MINUTES)
                .build();
    }

    /**
     * Returns the cached table or loads it once. Exceptions thrown by {@code loader}
     * propagate unchanged and nothing is cached for the key.
     */
    public RollupTable get(String version, TimeBucket bucket, EntityDimension dimension, Supplier<RollupTable> loader) {
        return tables.get(key(version, bucket, dimension), k -> loader.get());
    }

    public void invalidateVersion(String version) {
        String prefix = version + "|";
        tables.asMap().keySet().removeIf(k -> k.startsWith(prefix));
    }

    public long size() {
        return tables.estimatedSize();
    }

    private static String key(String version, TimeBucket bucket, EntityDimension dimension) {
        return version + "|" + bucket.id() + "|" + dimension.getKey();
    }
}
