package com.di.awardscope.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Reads the files of one snapshot version: {@code manifest.json}, {@code facts.csv} and
 * {@code agg_<dimension>.csv}. Stateless and thread-safe (Jackson readers are immutable).
 */
@Slf4j
public final class SnapshotFileReader {

    public static final String MANIFEST_FILE = "manifest.json";
    public static final String FACTS_FILE = "facts.csv";
    public static final String SECONDARY_DIR = "secondary";

    private final ObjectMapper jsonMapper;
    private final ObjectReader factReader;
    private final ObjectReader rollupReader;

    public SnapshotFileReader() {
        this.jsonMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        CsvMapper csvMapper = CsvMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
        CsvSchema headerSchema = CsvSchema.emptySchema().withHeader();
        this.factReader = csvMapper.readerFor(ContractFact.class).with(headerSchema);
        this.rollupReader = csvMapper.readerFor(RollupCsvRecord.class).with(headerSchema);
    }

    /* ------------------------------------------------------------------ */
    /* Manifest                                                             */
    /* ------------------------------------------------------------------ */

    public SnapshotManifest readManifest(Path versionDir) {
        Path file = versionDir.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(file)) {
            throw new SnapshotLoadException("Manifest not found: " + file);
        }
        try {
            SnapshotManifest manifest = jsonMapper.readValue(file.toFile(), SnapshotManifest.class);
            log.debug("[SNAPSHOT] Read manifest {} ({} buckets)", file,
                    manifest.getBuckets() != null ? manifest.getBuckets().size() : 0);
            return manifest;
        } catch (IOException e) {
            throw new SnapshotLoadException("Failed to read manifest " + file, e);
        }
    }

    public ObjectMapper jsonMapper() {
        return jsonMapper;
    }

    /* ------------------------------------------------------------------ */
    /* Facts                                                                */
    /* ------------------------------------------------------------------ */

    /**
     * Opens a streaming iterator over one fact file. The caller owns the returned iterator and
     * must close it; rows are parsed one at a time.
     */
    public MappingIterator<ContractFact> openFacts(Path factFile) {
        try {
            Reader reader = Files.newBufferedReader(factFile, StandardCharsets.UTF_8);
            return factReader.readValues(reader);
        } catch (IOException e) {
            throw new SnapshotLoadException("Failed to open fact file " + factFile, e);
        }
    }

    /* ------------------------------------------------------------------ */
    /* Rollups                                                              */
    /* ------------------------------------------------------------------ */

    /**
     * Reads a whole rollup table and checks it for duplicate entities, non-positive counts and
     * inverted date spans.
     *
     * @throws InternalInconsistencyException when the table contradicts itself
     */
    public RollupTable readRollup(Path rollupFile, TimeBucket bucket, EntityDimension dimension) {
        Map<String, EntityRollupRow> rows = new LinkedHashMap<>();
        try (Reader reader = Files.newBufferedReader(rollupFile, StandardCharsets.UTF_8);
             MappingIterator<RollupCsvRecord> it = rollupReader.readValues(reader)) {
            while (it.hasNext()) {
                RollupCsvRecord rec = it.next();
                EntityRollupRow row = toRow(rec, bucket, dimension);
                if (rows.putIfAbsent(row.getEntity(), row) != null) {
                    throw new InternalInconsistencyException(bucket, dimension,
                            "duplicate entity '" + row.getEntity() + "'");
                }
            }
        } catch (IOException | RuntimeException e) {
            if (e instanceof InternalInconsistencyException ie) throw ie;
            throw new SnapshotLoadException("Failed to read rollup file " + rollupFile, e);
        }
        log.debug("[SNAPSHOT] Read rollup {} ({} rows)", rollupFile, rows.size());
        return new RollupTable(bucket, dimension, rows);
    }

    private static EntityRollupRow toRow(RollupCsvRecord rec, TimeBucket bucket, EntityDimension dimension) {
        String entity = rec.getEntity() != null ? rec.getEntity().trim() : "";
        if (entity.isEmpty()) {
            throw new InternalInconsistencyException(bucket, dimension, "rollup row without entity name");
        }
        if (rec.getContractCount() <= 0) {
            throw new InternalInconsistencyException(bucket, dimension,
                    "entity '" + entity + "' has contract_count " + rec.getContractCount());
        }
        if (rec.getFirstDate() != null && rec.getLastDate() != null && rec.getFirstDate().isAfter(rec.getLastDate())) {
            throw new InternalInconsistencyException(bucket, dimension,
                    "entity '" + entity + "' has first_date after last_date");
        }
        EntityRollupRow.EntityRollupRowBuilder b = EntityRollupRow.builder()
                .dimension(dimension)
                .entity(entity)
                .bucket(bucket)
                .contractCount(rec.getContractCount())
                .totalValue(rec.getTotalValue())
                .firstDate(rec.getFirstDate())
                .lastDate(rec.getLastDate());
        for (EntityDimension other : dimension.counterparts()) {
            b.counterpart(other, splitNames(rec.counterpartColumn(other)));
        }
        return b.build();
    }

    static Set<String> splitNames(String joined) {
        Set<String> names = new LinkedHashSet<>();
        if (joined == null || joined.isBlank()) return names;
        for (String part : joined.split("\\|")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) names.add(trimmed);
        }
        return names;
    }

    /** Row shape of {@code agg_<dimension>.csv}. */
    @Data
    static class RollupCsvRecord {
        @JsonProperty("entity")
        private String entity;
        @JsonProperty("contract_count")
        private long contractCount;
        @JsonProperty("total_value")
        private double totalValue;
        @JsonProperty("first_date")
        private LocalDate firstDate;
        @JsonProperty("last_date")
        private LocalDate lastDate;
        @JsonProperty("contractors")
        private String contractors;
        @JsonProperty("organizations")
        private String organizations;
        @JsonProperty("areas")
        private String areas;
        @JsonProperty("business_categories")
        private String businessCategories;

        String counterpartColumn(EntityDimension d) {
            return switch (d) {
                case CONTRACTOR -> contractors;
                case ORGANIZATION -> organizations;
                case AREA -> areas;
                case BUSINESS_CATEGORY -> businessCategories;
            };
        }
    }
}
