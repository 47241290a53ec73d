package com.di.awardscope.controller.dto;

import com.di.awardscope.snapshot.Snapshot;
import com.di.awardscope.snapshot.SnapshotManifest;
import com.di.awardscope.snapshot.TimeBucket;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/** Active snapshot as reported by {@code GET /api/snapshot}. */
public record SnapshotSummary(
        @JsonProperty("version") String version,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("min_date") LocalDate minDate,
        @JsonProperty("max_date") LocalDate maxDate,
        @JsonProperty("buckets") List<String> buckets,
        @JsonProperty("fact_rows") long factRows,
        @JsonProperty("secondary_rows") long secondaryRows) {

    public static SnapshotSummary of(Snapshot snapshot) {
        SnapshotManifest manifest = snapshot.getManifest();
        List<String> ids = manifest.getBuckets().stream()
                .map(SnapshotManifest.BucketEntry::getId)
                .toList();
        long factRows = manifest.find(TimeBucket.ALL_TIME)
                .map(SnapshotManifest.BucketEntry::getFactRows)
                .orElse(-1L);
        return new SnapshotSummary(snapshot.getVersion(), manifest.getCreatedAt(), manifest.getMinDate(),
                manifest.getMaxDate(), ids, factRows, manifest.getSecondaryRows());
    }
}
