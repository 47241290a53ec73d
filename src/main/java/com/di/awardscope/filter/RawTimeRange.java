package com.di.awardscope.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One entry of {@code time_ranges}, kept as the JSON the client sent. Accepted shapes:
 * <pre>
 * ["2020-01-01", "2020-12-31"]
 * {"type": "yearly", "year": 2020}
 * {"type": "quarterly", "year": 2021, "quarter": 2}
 * {"type": "custom", "startDate": "2020-02-01", "endDate": "2020-05-31"}
 * </pre>
 * Interpretation happens in {@link FilterNormalizer} so that errors can name the entry's index.
 */
public final class RawTimeRange {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final JsonNode node;

    private RawTimeRange(JsonNode node) {
        this.node = node;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RawTimeRange of(JsonNode node) {
        return new RawTimeRange(node != null ? node : NODES.nullNode());
    }

    public static RawTimeRange between(String start, String end) {
        ArrayNode pair = NODES.arrayNode();
        pair.add(start);
        pair.add(end);
        return new RawTimeRange(pair);
    }

    public static RawTimeRange yearly(int year) {
        ObjectNode o = NODES.objectNode();
        o.put("type", "yearly");
        o.put("year", year);
        return new RawTimeRange(o);
    }

    public static RawTimeRange quarterly(int year, int quarter) {
        ObjectNode o = NODES.objectNode();
        o.put("type", "quarterly");
        o.put("year", year);
        o.put("quarter", quarter);
        return new RawTimeRange(o);
    }

    public static RawTimeRange custom(String startDate, String endDate) {
        ObjectNode o = NODES.objectNode();
        o.put("type", "custom");
        o.put("startDate", startDate);
        o.put("endDate", endDate);
        return new RawTimeRange(o);
    }

    @JsonValue
    public JsonNode node() {
        return node;
    }

    @Override
    public String toString() {
        return node.toString();
    }
}
