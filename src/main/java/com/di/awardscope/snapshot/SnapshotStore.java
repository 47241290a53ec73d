package com.di.awardscope.snapshot;

import com.di.awardscope.util.MetricsCollector;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Owns the handle on the active snapshot version. The handle is the only shared mutable state of
 * the query engine; it is swapped atomically by {@link #activate(String)} and read without locks.
 */
@Slf4j
@Service
public class SnapshotStore {

    private final SnapshotProperties properties;
    private final RollupCache rollupCache;
    private final MetricsCollector metricsCollector;
    private final SnapshotFileReader reader = new SnapshotFileReader();
    private final AtomicReference<Snapshot> current = new AtomicReference<>();

    public SnapshotStore(SnapshotProperties properties, RollupCache rollupCache, MetricsCollector metricsCollector) {
        this.properties = properties;
        this.rollupCache = rollupCache;
        this.metricsCollector = metricsCollector;
    }

    /**
     * Activates the configured version, or the newest one under the root. A missing or empty root
     * leaves the store empty; queries then fail with {@link SnapshotUnavailableException}.
     */
    @PostConstruct
    public void initialize() {
        if (!properties.isLoadOnStartup()) {
            log.info("[SNAPSHOT] load-on-startup disabled; waiting for activation");
            return;
        }
        String version = properties.getVersion();
        if (version == null || version.isBlank()) {
            Optional<String> newest = newestVersion();
            if (newest.isEmpty()) {
                log.warn("[SNAPSHOT] No snapshot version found under {}; store stays empty", root());
                return;
            }
            version = newest.get();
        }
        activate(version);
    }

    /**
     * Returns the active snapshot.
     *
     * @throws SnapshotUnavailableException when no version has been activated
     */
    public Snapshot current() {
        Snapshot snapshot = current.get();
        if (snapshot == null) {
            throw new SnapshotUnavailableException("No snapshot is active (root: " + root() + ")");
        }
        return snapshot;
    }

    /**
     * Loads and validates {@code <root>/<version>} and makes it the active snapshot. Requests that
     * already captured the previous handle finish on it.
     *
     * @throws SnapshotLoadException when the directory or its manifest is unusable
     */
    public Snapshot activate(String version) {
        if (version == null || version.isBlank() || version.contains("/") || version.contains("\\") || version.contains("..")) {
            throw new SnapshotLoadException("Invalid snapshot version: '" + version + "'");
        }
        Path dir = root().resolve(version);
        if (!Files.isDirectory(dir)) {
            throw new SnapshotLoadException("Snapshot directory not found: " + dir);
        }
        SnapshotManifest manifest = reader.readManifest(dir);
        validate(version, dir, manifest);

        Snapshot next = new Snapshot(version, dir, manifest, reader, rollupCache);
        Snapshot previous = current.getAndSet(next);
        metricsCollector.recordSnapshotActivation();
        log.info("[SNAPSHOT] Activated version {} ({} buckets, {}..{}){}", version, manifest.getBuckets().size(),
                manifest.getMinDate(), manifest.getMaxDate(),
                previous != null ? " replacing " + previous.getVersion() : "");
        if (previous != null && !previous.getVersion().equals(version)) {
            rollupCache.invalidateVersion(previous.getVersion());
        }
        return next;
    }

    private void validate(String version, Path dir, SnapshotManifest manifest) {
        if (manifest.getMinDate() == null || manifest.getMaxDate() == null) {
            throw new SnapshotLoadException("Manifest of " + version + " lacks minDate/maxDate");
        }
        if (manifest.getMinDate().isAfter(manifest.getMaxDate())) {
            throw new SnapshotLoadException("Manifest of " + version + " has minDate after maxDate");
        }
        if (manifest.getVersion() != null && !manifest.getVersion().equals(version)) {
            log.warn("[SNAPSHOT] Manifest version '{}' differs from directory name '{}'", manifest.getVersion(), version);
        }
        for (SnapshotManifest.BucketEntry entry : manifest.getBuckets()) {
            TimeBucket bucket;
            try {
                bucket = entry.bucket();
            } catch (IllegalArgumentException e) {
                throw new SnapshotLoadException("Manifest of " + version + " lists an invalid bucket", e);
            }
            if (!Files.isDirectory(dir.resolve(bucket.id()))) {
                throw new SnapshotLoadException("Bucket directory missing: " + dir.resolve(bucket.id()));
            }
            for (String key : entry.getRollups().keySet()) {
                try {
                    EntityDimension.fromKey(key);
                } catch (IllegalArgumentException e) {
                    throw new SnapshotLoadException("Manifest of " + version + " lists unknown rollup '" + key
                            + "' in " + bucket.id(), e);
                }
            }
        }
    }

    /** Lexicographically greatest sub-directory of the root that holds a manifest. */
    Optional<String> newestVersion() {
        Path root = root();
        if (!Files.isDirectory(root)) {
            return Optional.empty();
        }
        try (Stream<Path> children = Files.list(root)) {
            return children
                    .filter(Files::isDirectory)
                    .filter(p -> Files.isRegularFile(p.resolve(SnapshotFileReader.MANIFEST_FILE)))
                    .map(p -> p.getFileName().toString())
                    .max(Comparator.naturalOrder());
        } catch (IOException e) {
            throw new SnapshotLoadException("Failed to list snapshot root " + root, e);
        }
    }

    private Path root() {
        return Paths.get(properties.getRoot());
    }
}
