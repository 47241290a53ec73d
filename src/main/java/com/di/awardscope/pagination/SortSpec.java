package com.di.awardscope.pagination;

import com.di.awardscope.aggregate.AggregateRow;

import java.util.Comparator;
import java.util.Locale;

/**
 * Ordering of aggregated rows. The measure is always followed by entity name ascending
 * (case-insensitive), then the exact name, so the order is total and repeatable.
 */
public record SortSpec(SortField field, SortDirection direction) {

    public static final SortSpec DEFAULT = new SortSpec(SortField.TOTAL_VALUE, SortDirection.DESC);

    private static final Comparator<AggregateRow> TIE_BREAK =
            Comparator.comparing(AggregateRow::getEntity, String.CASE_INSENSITIVE_ORDER)
                    .thenComparing(AggregateRow::getEntity);

    /** Parses wire keys; the direction defaults to desc for measures and asc for the entity name. */
    public static SortSpec of(String field, String direction) {
        SortField f = SortField.fromKey(field);
        SortDirection fallback = f == SortField.ENTITY_NAME ? SortDirection.ASC : SortDirection.DESC;
        return new SortSpec(f, SortDirection.fromKey(direction, fallback));
    }

    public Comparator<AggregateRow> comparator() {
        Comparator<AggregateRow> primary = direction == SortDirection.DESC
                ? field.ascending().reversed()
                : field.ascending();
        return primary.thenComparing(TIE_BREAK);
    }

    @Override
    public String toString() {
        return field.getKey() + " " + direction.name().toLowerCase(Locale.ROOT);
    }
}
