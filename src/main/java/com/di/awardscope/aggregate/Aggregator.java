package com.di.awardscope.aggregate;

import com.di.awardscope.filter.FilterChipSet;
import com.di.awardscope.planner.QueryPlan;
import com.di.awardscope.snapshot.ContractFact;
import com.di.awardscope.snapshot.EntityDimension;
import com.di.awardscope.snapshot.EntityRollupRow;
import com.di.awardscope.snapshot.RollupTable;
import com.di.awardscope.snapshot.Snapshot;
import com.di.awardscope.snapshot.SnapshotManifest;
import com.di.awardscope.snapshot.TimeBucket;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes a {@link QueryPlan} and merges partial aggregates into one row per entity.
 *
 * <p>Rollup plans sum counts and values per entity across buckets and union counterpart sets;
 * scan plans accumulate the same measures fact by fact. Averages are derived only after merging.
 * Global totals come from the manifest for rollup plans and from the same pass for scans.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Aggregator {

    private final FactScanner factScanner;

    public AggregationResult aggregate(Snapshot snapshot, QueryPlan plan, FilterChipSet chips) {
        if (plan.targetDimension() == null) {
            throw new IllegalArgumentException("aggregation needs a target dimension");
        }
        long start = System.currentTimeMillis();
        AggregationResult result = plan.isRollup()
                ? mergeRollups(snapshot, plan, chips)
                : scanFacts(snapshot, plan, chips);
        log.info("[AGGREGATE] {} {} -> {} entities in {} ms (global: {} contracts)",
                plan.kind(), plan.targetDimension().getKey(), result.rows().size(),
                System.currentTimeMillis() - start, result.globalTotals().contractCount());
        return result;
    }

    /* ------------------------------------------------------------------ */
    /* Rollup merge                                                         */
    /* ------------------------------------------------------------------ */

    private AggregationResult mergeRollups(Snapshot snapshot, QueryPlan plan, FilterChipSet chips) {
        EntityDimension dim = plan.targetDimension();
        Map<String, EntityAggregate> byEntity = new HashMap<>();
        for (TimeBucket bucket : plan.rollupBuckets()) {
            RollupTable table = snapshot.rollup(bucket, dim);
            int kept = 0;
            for (EntityRollupRow row : table.rows()) {
                if (!chips.matchesEntity(dim, row.getEntity())) {
                    continue;
                }
                byEntity.computeIfAbsent(row.getEntity(), name -> new EntityAggregate(dim, name)).merge(row);
                kept++;
            }
            log.debug("[AGGREGATE] {}/{}: kept {} of {} rollup rows", bucket.id(), dim.getKey(), kept, table.size());
        }
        return new AggregationResult(plan, finish(byEntity), manifestTotals(snapshot.getManifest(), plan));
    }

    /** Sums the manifest's per-bucket totals over the rollup buckets. */
    static GlobalTotals manifestTotals(SnapshotManifest manifest, QueryPlan plan) {
        long count = 0;
        double total = 0.0;
        for (TimeBucket bucket : plan.rollupBuckets()) {
            SnapshotManifest.BucketEntry entry = manifest.find(bucket).orElse(null);
            if (entry == null) {
                continue;
            }
            if (entry.hasFacts()) {
                count += entry.getFactRows();
            } else {
                count += entry.rollup(plan.targetDimension()).map(SnapshotManifest.RollupEntry::getContracts).orElse(0L);
            }
            total += entry.getTotalValue();
        }
        return GlobalTotals.of(count, total);
    }

    /* ------------------------------------------------------------------ */
    /* Fact scan                                                            */
    /* ------------------------------------------------------------------ */

    private AggregationResult scanFacts(Snapshot snapshot, QueryPlan plan, FilterChipSet chips) {
        EntityDimension dim = plan.targetDimension();
        Map<String, EntityAggregate> byEntity = new HashMap<>();
        long[] globalCount = new long[1];
        double[] globalTotal = new double[1];
        factScanner.scan(snapshot, plan, chips, new FactScanner.Visitor() {
            @Override
            public void inRange(ContractFact fact) {
                globalCount[0]++;
                globalTotal[0] += fact.getContractAmount();
            }

            @Override
            public void matched(ContractFact fact) {
                String name = dim.nameOf(fact);
                if (name == null || name.isBlank()) {
                    return;
                }
                byEntity.computeIfAbsent(name.trim(), n -> new EntityAggregate(dim, n)).add(fact);
            }
        });
        return new AggregationResult(plan, finish(byEntity), GlobalTotals.of(globalCount[0], globalTotal[0]));
    }

    private static List<AggregateRow> finish(Map<String, EntityAggregate> byEntity) {
        List<AggregateRow> rows = new ArrayList<>(byEntity.size());
        for (EntityAggregate agg : byEntity.values()) {
            if (agg.contractCount() > 0) {
                rows.add(agg.toRow());
            }
        }
        return rows;
    }
}
