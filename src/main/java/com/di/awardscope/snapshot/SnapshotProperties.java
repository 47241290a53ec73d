package com.di.awardscope.snapshot;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Binding for snapshot location and rollup caching.
 *
 * <pre>
 * awardscope:
 *   snapshot:
 *     root: /data/awardscope/snapshots
 *     version:                      # blank = newest version directory with a manifest
 *     load-on-startup: true
 *     rollup-cache-max-size: 512
 *     rollup-cache-expire-after-access-minutes: 60
 * </pre>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "awardscope.snapshot")
public class SnapshotProperties {

    /** Directory holding one sub-directory per snapshot version. */
    @NotBlank
    private String root = "data/snapshots";

    /** Version to activate at startup. Blank picks the lexicographically greatest version. */
    private String version;

    /** When false the store starts empty and waits for {@code POST /api/snapshot/activate}. */
    private boolean loadOnStartup = true;

    /** Maximum number of (version, bucket, dimension) rollup tables kept in memory. */
    @Positive
    private int rollupCacheMaxSize = 512;

    /** Rollup tables not read for this long are evicted; swapped-out versions age out this way. */
    @Positive
    private int rollupCacheExpireAfterAccessMinutes = 60;
}
