package com.di.awardscope.export;

import com.di.awardscope.aggregate.AggregateRow;
import com.di.awardscope.pagination.RankedAggregate;
import com.di.awardscope.snapshot.ContractFact;
import com.di.awardscope.snapshot.EntityDimension;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed column layouts of exported files. Columns never depend on the data.
 *
 * <ul>
 *   <li>raw: the fact file columns</li>
 *   <li>aggregated: {@code rank,<dimension>,contract_count,total_value,average_value,first_date,last_date}
 *       then {@code <other>_count} for the three other dimensions in enum order</li>
 * </ul>
 */
public final class ExportColumns {

    public static final List<String> RAW = List.of(
            "reference_id", "contract_no", "award_title", "notice_title", "awardee_name",
            "organization_name", "area_of_delivery", "business_category", "contract_amount", "award_date");

    private ExportColumns() {
    }

    /** Raw layout when {@code dimension} is null, otherwise the aggregated layout. */
    public static List<String> header(EntityDimension dimension) {
        if (dimension == null) {
            return RAW;
        }
        List<String> cols = new ArrayList<>(10);
        cols.add("rank");
        cols.add(dimension.getKey());
        cols.add("contract_count");
        cols.add("total_value");
        cols.add("average_value");
        cols.add("first_date");
        cols.add("last_date");
        for (EntityDimension other : dimension.counterparts()) {
            cols.add(other.getKey() + "_count");
        }
        return List.copyOf(cols);
    }

    /** UTF-8 size of the header line including its line break. */
    public static long headerBytes(EntityDimension dimension, ExportFormat format) {
        String line = String.join(String.valueOf(format.getSeparator()), header(dimension)) + "\n";
        return line.getBytes(StandardCharsets.UTF_8).length;
    }

    static Map<String, String> headerRow(List<String> columns) {
        Map<String, String> row = new LinkedHashMap<>();
        for (String c : columns) {
            row.put(c, c);
        }
        return row;
    }

    static Map<String, String> rawRow(ContractFact f) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("reference_id", text(f.getReferenceId()));
        row.put("contract_no", text(f.getContractNo()));
        row.put("award_title", text(f.getAwardTitle()));
        row.put("notice_title", text(f.getNoticeTitle()));
        row.put("awardee_name", text(f.getAwardeeName()));
        row.put("organization_name", text(f.getOrganizationName()));
        row.put("area_of_delivery", text(f.getAreaOfDelivery()));
        row.put("business_category", text(f.getBusinessCategory()));
        row.put("contract_amount", number(f.getContractAmount()));
        row.put("award_date", date(f.getAwardDate()));
        return row;
    }

    static Map<String, String> aggregatedRow(RankedAggregate ranked, EntityDimension dimension) {
        AggregateRow r = ranked.row();
        Map<String, String> row = new LinkedHashMap<>();
        row.put("rank", String.valueOf(ranked.rank()));
        row.put(dimension.getKey(), text(r.getEntity()));
        row.put("contract_count", String.valueOf(r.getContractCount()));
        row.put("total_value", number(r.getTotalValue()));
        row.put("average_value", number(r.getAverageValue()));
        row.put("first_date", date(r.getFirstDate()));
        row.put("last_date", date(r.getLastDate()));
        for (EntityDimension other : dimension.counterparts()) {
            row.put(other.getKey() + "_count", String.valueOf(r.counterpartCount(other)));
        }
        return row;
    }

    private static String text(String s) {
        return s != null ? s : "";
    }

    static String number(double v) {
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }

    private static String date(LocalDate d) {
        return d != null ? d.toString() : "";
    }
}
