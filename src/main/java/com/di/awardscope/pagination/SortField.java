package com.di.awardscope.pagination;

import com.di.awardscope.aggregate.AggregateRow;
import com.di.awardscope.filter.FilterValidationException;

import java.util.Comparator;
import java.util.Locale;

/** Measures aggregated rows can be ordered by. */
public enum SortField {

    TOTAL_VALUE("total_value", Comparator.comparingDouble(AggregateRow::getTotalValue)),
    CONTRACT_COUNT("contract_count", Comparator.comparingLong(AggregateRow::getContractCount)),
    AVERAGE_VALUE("average_value", Comparator.comparingDouble(AggregateRow::getAverageValue)),
    ENTITY_NAME("entity_name", Comparator.comparing(AggregateRow::getEntity, String.CASE_INSENSITIVE_ORDER));

    private final String key;
    private final Comparator<AggregateRow> ascending;

    SortField(String key, Comparator<AggregateRow> ascending) {
        this.key = key;
        this.ascending = ascending;
    }

    public String getKey() {
        return key;
    }

    Comparator<AggregateRow> ascending() {
        return ascending;
    }

    /**
     * @throws FilterValidationException for unknown keys
     */
    public static SortField fromKey(String raw) {
        if (raw == null || raw.isBlank()) {
            return TOTAL_VALUE;
        }
        String k = raw.trim().toLowerCase(Locale.ROOT);
        for (SortField f : values()) {
            if (f.key.equals(k)) return f;
        }
        throw new FilterValidationException("sort.field", raw,
                "expected one of total_value, contract_count, average_value, entity_name");
    }
}
