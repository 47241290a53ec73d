package com.di.awardscope.aggregate;

import com.di.awardscope.aggregate.ChartAggregates.LabelTotal;
import com.di.awardscope.aggregate.ChartAggregates.MonthTotal;
import com.di.awardscope.aggregate.ChartAggregates.YearTotal;
import com.di.awardscope.filter.FilterChipSet;
import com.di.awardscope.planner.QueryPlan;
import com.di.awardscope.snapshot.EntityDimension;
import com.di.awardscope.snapshot.Snapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Chart aggregates and the value histogram over the facts matching a chip set. Both work from a
 * fact-scan plan; rollups hold no per-month or per-amount breakdown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChartAggregator {

    private static final Comparator<Map.Entry<String, Tally>> BY_TOTAL_DESC =
            Comparator.comparingDouble((Map.Entry<String, Tally> e) -> e.getValue().total).reversed()
                    .thenComparing(Map.Entry::getKey);

    private final FactScanner factScanner;

    /**
     * One pass over the matching facts. Facts without an award date count toward the summary
     * only; blank entity names are left out of the top lists.
     *
     * @param topN entities kept per dimension
     */
    public ChartAggregates charts(Snapshot snapshot, QueryPlan plan, FilterChipSet chips, int topN) {
        Tally summary = new Tally();
        Map<Integer, Tally> years = new TreeMap<>();
        Map<YearMonth, Tally> months = new TreeMap<>();
        Map<EntityDimension, Map<String, Tally>> entities = new EnumMap<>(EntityDimension.class);
        for (EntityDimension d : EntityDimension.values()) {
            entities.put(d, new HashMap<>());
        }

        factScanner.scan(snapshot, plan, chips, fact -> {
            double amount = fact.getContractAmount();
            summary.add(amount);
            if (fact.getAwardDate() != null) {
                years.computeIfAbsent(fact.getAwardDate().getYear(), y -> new Tally()).add(amount);
                months.computeIfAbsent(YearMonth.from(fact.getAwardDate()), m -> new Tally()).add(amount);
            }
            for (EntityDimension d : EntityDimension.values()) {
                String name = d.nameOf(fact);
                if (name != null && !name.isBlank()) {
                    entities.get(d).computeIfAbsent(name, n -> new Tally()).add(amount);
                }
            }
        });

        List<YearTotal> byYear = new ArrayList<>(years.size());
        years.forEach((year, t) -> byYear.add(new YearTotal(year, t.total, t.count)));
        List<MonthTotal> byMonth = new ArrayList<>(months.size());
        months.forEach((month, t) -> byMonth.add(new MonthTotal(month.toString(), t.total, t.count)));

        log.debug("[CHARTS] {} facts, {} years, {} months, top {}", summary.count, byYear.size(), byMonth.size(), topN);
        return new ChartAggregates(
                GlobalTotals.of(summary.count, summary.total),
                byYear,
                byMonth,
                top(entities.get(EntityDimension.CONTRACTOR), topN),
                top(entities.get(EntityDimension.ORGANIZATION), topN),
                top(entities.get(EntityDimension.AREA), topN),
                top(entities.get(EntityDimension.BUSINESS_CATEGORY), topN));
    }

    /**
     * Histogram of the positive amounts among the matching facts. The first pass finds the
     * amount range, the second fills the bins; amounts equal to the maximum land in the last bin.
     */
    public ValueDistribution valueDistribution(Snapshot snapshot, QueryPlan plan, FilterChipSet chips, int numBins) {
        double[] range = {Double.MAX_VALUE, 0.0};
        long[] total = new long[1];
        factScanner.scan(snapshot, plan, chips, fact -> {
            double amount = fact.getContractAmount();
            if (amount > 0) {
                range[0] = Math.min(range[0], amount);
                range[1] = Math.max(range[1], amount);
                total[0]++;
            }
        });
        if (total[0] == 0) {
            return ValueDistribution.empty(numBins);
        }

        double min = range[0];
        double max = range[1];
        double width = (max - min) / numBins;
        long[] counts = new long[numBins];
        double[] sums = new double[numBins];
        factScanner.scan(snapshot, plan, chips, fact -> {
            double amount = fact.getContractAmount();
            if (amount > 0) {
                int bin = binOf(amount, min, width, numBins);
                counts[bin - 1]++;
                sums[bin - 1] += amount;
            }
        });

        List<ValueDistribution.Bin> bins = new ArrayList<>();
        for (int i = 0; i < numBins; i++) {
            if (counts[i] > 0) {
                bins.add(new ValueDistribution.Bin(i + 1, min + i * width, min + (i + 1) * width,
                        counts[i], sums[i], sums[i] / counts[i]));
            }
        }
        log.debug("[CHARTS] Value distribution: {} contracts in {} of {} bins, width {}", total[0], bins.size(), numBins, width);
        return new ValueDistribution(min, max, width, numBins, total[0], bins);
    }

    /** 1-based bin of {@code amount}; everything falls in bin 1 when all amounts are equal. */
    static int binOf(double amount, double min, double width, int numBins) {
        if (width <= 0) {
            return 1;
        }
        long bin = (long) Math.floor((amount - min) / width) + 1;
        return (int) Math.max(1, Math.min(bin, numBins));
    }

    private static List<LabelTotal> top(Map<String, Tally> tallies, int topN) {
        return tallies.entrySet().stream()
                .sorted(BY_TOTAL_DESC)
                .limit(topN)
                .map(e -> new LabelTotal(e.getKey(), e.getValue().total, e.getValue().count))
                .toList();
    }

    private static final class Tally {
        long count;
        double total;

        void add(double amount) {
            count++;
            total += amount;
        }
    }
}
