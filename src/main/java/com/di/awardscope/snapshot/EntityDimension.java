package com.di.awardscope.snapshot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * The four entity dimensions a contract is attributed to. Closed set: filters, rollups and
 * aggregated exports are all keyed by one of these.
 */
public enum EntityDimension {

    CONTRACTOR("contractor", "contractors", ContractFact::getAwardeeName),
    ORGANIZATION("organization", "organizations", ContractFact::getOrganizationName),
    AREA("area", "areas", ContractFact::getAreaOfDelivery),
    BUSINESS_CATEGORY("business_category", "business_categories", ContractFact::getBusinessCategory);

    private final String key;
    private final String pluralKey;
    private final Function<ContractFact, String> extractor;

    EntityDimension(String key, String pluralKey, Function<ContractFact, String> extractor) {
        this.key = key;
        this.pluralKey = pluralKey;
        this.extractor = extractor;
    }

    /** Wire key, e.g. {@code business_category}. */
    @JsonValue
    public String getKey() {
        return key;
    }

    /** Column name of the counterpart set in rollup files, e.g. {@code contractors}. */
    public String getPluralKey() {
        return pluralKey;
    }

    /** File name of this dimension's rollup table inside a bucket directory. */
    public String rollupFileName() {
        return "agg_" + key + ".csv";
    }

    /** Returns the entity name of the given fact in this dimension (may be blank). */
    public String nameOf(ContractFact fact) {
        return extractor.apply(fact);
    }

    /** The other three dimensions, in declaration order. */
    public List<EntityDimension> counterparts() {
        List<EntityDimension> out = new ArrayList<>(3);
        for (EntityDimension d : values()) {
            if (d != this) out.add(d);
        }
        return out;
    }

    /**
     * Resolves a wire key ({@code contractor}, {@code by_contractor}, {@code CONTRACTOR}).
     *
     * @throws IllegalArgumentException when the key names no dimension
     */
    @JsonCreator
    public static EntityDimension fromKey(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("dimension key cannot be null or empty");
        }
        String k = raw.trim().toLowerCase(Locale.ROOT);
        if (k.startsWith("by_")) k = k.substring(3);
        if ("category".equals(k)) k = "business_category";
        for (EntityDimension d : values()) {
            if (d.key.equals(k) || d.pluralKey.equals(k)) return d;
        }
        throw new IllegalArgumentException("Unknown entity dimension: '" + raw + "'");
    }
}
