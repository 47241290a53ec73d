package com.di.awardscope.pagination;

import com.di.awardscope.filter.FilterValidationException;

import java.util.Locale;

public enum SortDirection {
    ASC,
    DESC;

    /**
     * @throws FilterValidationException for anything but {@code asc} / {@code desc}
     */
    public static SortDirection fromKey(String raw, SortDirection fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "asc" -> ASC;
            case "desc" -> DESC;
            default -> throw new FilterValidationException("sort.direction", raw, "expected asc or desc");
        };
    }
}
