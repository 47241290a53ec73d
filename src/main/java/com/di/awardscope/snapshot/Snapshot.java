package com.di.awardscope.snapshot;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Read-only handle on one activated snapshot version. Requests capture the handle once and use it
 * for their whole lifetime, so a concurrent swap never mixes two versions inside one answer.
 */
@Slf4j
public final class Snapshot {

    private final String version;
    private final Path directory;
    private final SnapshotManifest manifest;
    private final SnapshotFileReader reader;
    private final RollupCache rollupCache;

    Snapshot(String version, Path directory, SnapshotManifest manifest, SnapshotFileReader reader, RollupCache rollupCache) {
        this.version = version;
        this.directory = directory;
        this.manifest = manifest;
        this.reader = reader;
        this.rollupCache = rollupCache;
    }

    public String getVersion() {
        return version;
    }

    public Path getDirectory() {
        return directory;
    }

    public SnapshotManifest getManifest() {
        return manifest;
    }

    /**
     * Returns the rollup table of {@code dimension} in {@code bucket}, reading and validating it on
     * first use.
     *
     * @throws SnapshotLoadException          when the manifest does not declare the table or the file is unreadable
     * @throws InternalInconsistencyException when the table disagrees with the manifest or itself
     */
    public RollupTable rollup(TimeBucket bucket, EntityDimension dimension) {
        SnapshotManifest.RollupEntry declared = manifest.find(bucket)
                .flatMap(e -> e.rollup(dimension))
                .orElseThrow(() -> new SnapshotLoadException(
                        "Snapshot " + version + " declares no " + dimension.getKey() + " rollup for " + bucket.id()));
        return rollupCache.get(version, bucket, dimension, () -> loadRollup(bucket, dimension, declared));
    }

    private RollupTable loadRollup(TimeBucket bucket, EntityDimension dimension, SnapshotManifest.RollupEntry declared) {
        Path file = directory.resolve(bucket.id()).resolve(dimension.rollupFileName());
        if (!Files.isRegularFile(file)) {
            throw new SnapshotLoadException("Rollup file missing: " + file);
        }
        RollupTable table = reader.readRollup(file, bucket, dimension);
        if (table.size() != declared.getRows()) {
            throw new InternalInconsistencyException(bucket, dimension,
                    "manifest declares " + declared.getRows() + " rows, file has " + table.size());
        }
        if (table.getContractCount() != declared.getContracts()) {
            throw new InternalInconsistencyException(bucket, dimension,
                    "manifest declares " + declared.getContracts() + " contracts, rows sum to " + table.getContractCount());
        }
        log.info("[SNAPSHOT] Loaded rollup {}/{}/{} ({} rows)", version, bucket.id(), dimension.getKey(), table.size());
        return table;
    }

    /**
     * Opens a cursor over the fact files of {@code buckets} (in the given order), followed by the
     * secondary dataset when {@code includeSecondary} is set and this version ships one.
     */
    public FactCursor openFacts(List<TimeBucket> buckets, boolean includeSecondary) {
        List<Path> files = new ArrayList<>(buckets.size() + 1);
        for (TimeBucket bucket : buckets) {
            Path file = directory.resolve(bucket.id()).resolve(SnapshotFileReader.FACTS_FILE);
            if (!Files.isRegularFile(file)) {
                throw new SnapshotLoadException("Fact file missing: " + file);
            }
            files.add(file);
        }
        if (includeSecondary) {
            Path secondary = secondaryFactFile();
            if (Files.isRegularFile(secondary)) {
                files.add(secondary);
            } else {
                log.debug("[SNAPSHOT] Version {} ships no secondary dataset", version);
            }
        }
        return new FactCursor(reader, files);
    }

    public boolean hasSecondaryDataset() {
        return Files.isRegularFile(secondaryFactFile());
    }

    private Path secondaryFactFile() {
        return directory.resolve(SnapshotFileReader.SECONDARY_DIR).resolve(SnapshotFileReader.FACTS_FILE);
    }

    /**
     * Distinct entity names per dimension (from the all-time rollups, sorted case-insensitively)
     * and the covered years. Dimensions without an all-time rollup list no names.
     */
    public FilterOptions filterOptions() {
        Map<EntityDimension, List<String>> names = new EnumMap<>(EntityDimension.class);
        for (EntityDimension d : EntityDimension.values()) {
            TreeSet<String> sorted = new TreeSet<>(String.CASE_INSENSITIVE_ORDER.thenComparing(s -> s));
            if (manifest.hasRollup(TimeBucket.ALL_TIME, d)) {
                for (EntityRollupRow row : rollup(TimeBucket.ALL_TIME, d).rows()) {
                    sorted.add(row.getEntity());
                }
            }
            names.put(d, new ArrayList<>(sorted));
        }
        return new FilterOptions(
                names.get(EntityDimension.CONTRACTOR),
                names.get(EntityDimension.ORGANIZATION),
                names.get(EntityDimension.AREA),
                names.get(EntityDimension.BUSINESS_CATEGORY),
                new ArrayList<>(manifest.coveredYears()));
    }

    @Override
    public String toString() {
        return "Snapshot{" + version + " @ " + directory + "}";
    }
}
