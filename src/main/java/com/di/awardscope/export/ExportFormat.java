package com.di.awardscope.export;

import com.di.awardscope.filter.FilterValidationException;

import java.util.Locale;

/** Delimited text formats an export can be written in. */
public enum ExportFormat {

    CSV("csv", ',', "text/csv"),
    TSV("tsv", '\t', "text/tab-separated-values");

    private final String key;
    private final char separator;
    private final String mediaType;

    ExportFormat(String key, char separator, String mediaType) {
        this.key = key;
        this.separator = separator;
        this.mediaType = mediaType;
    }

    public String getKey() {
        return key;
    }

    public char getSeparator() {
        return separator;
    }

    public String getMediaType() {
        return mediaType;
    }

    /**
     * @throws FilterValidationException for anything but {@code csv} / {@code tsv}
     */
    public static ExportFormat fromKey(String raw) {
        if (raw == null || raw.isBlank()) {
            return CSV;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "csv" -> CSV;
            case "tsv" -> TSV;
            default -> throw new FilterValidationException("format", raw, "expected csv or tsv");
        };
    }
}
