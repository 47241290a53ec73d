package com.di.awardscope.filter;

import com.di.awardscope.snapshot.SnapshotManifest;

import java.time.LocalDate;

/**
 * Date domain of the active snapshot. Time ranges must overlap {@code [minDate, maxDate]} and are
 * clamped to whole years: {@code [Jan 1 of minDate's year, Dec 31 of maxDate's year]}.
 */
public record DatasetBounds(LocalDate minDate, LocalDate maxDate) {

    public static DatasetBounds of(SnapshotManifest manifest) {
        return new DatasetBounds(manifest.getMinDate(), manifest.getMaxDate());
    }

    public LocalDate clampStart() {
        return LocalDate.of(minDate.getYear(), 1, 1);
    }

    public LocalDate clampEnd() {
        return LocalDate.of(maxDate.getYear(), 12, 31);
    }
}
