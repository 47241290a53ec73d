package com.di.awardscope.snapshot;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.Locale;

/**
 * One awarded contract. Immutable; never changed after the snapshot is built.
 * Field names on the wire and in fact files are the snake_case column names.
 */
@Value
@Builder
@Jacksonized
public class ContractFact {

    @JsonProperty("reference_id")
    String referenceId;

    @JsonProperty("contract_no")
    String contractNo;

    @JsonProperty("award_title")
    String awardTitle;

    @JsonProperty("notice_title")
    String noticeTitle;

    @JsonProperty("awardee_name")
    String awardeeName;

    @JsonProperty("organization_name")
    String organizationName;

    @JsonProperty("area_of_delivery")
    String areaOfDelivery;

    @JsonProperty("business_category")
    String businessCategory;

    @JsonProperty("contract_amount")
    double contractAmount;

    @JsonProperty("award_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate awardDate;

    /**
     * Lower-cased text that keyword chips are matched against: titles, awardee, organization,
     * business category and area, space separated, blanks skipped.
     */
    public String searchText() {
        StringBuilder sb = new StringBuilder(128);
        append(sb, awardTitle);
        append(sb, noticeTitle);
        append(sb, awardeeName);
        append(sb, organizationName);
        append(sb, businessCategory);
        append(sb, areaOfDelivery);
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    private static void append(StringBuilder sb, String value) {
        if (value == null || value.isBlank()) return;
        if (sb.length() > 0) sb.append(' ');
        sb.append(value);
    }
}
