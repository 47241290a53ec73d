package com.di.awardscope.aggregate;

import com.di.awardscope.filter.FilterChipSet;
import com.di.awardscope.planner.QueryPlan;
import com.di.awardscope.snapshot.ContractFact;
import com.di.awardscope.snapshot.FactCursor;
import com.di.awardscope.snapshot.Snapshot;
import com.di.awardscope.util.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.Closeable;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.CancellationException;

/**
 * Streams the fact files of a scan plan and evaluates the chip predicates row by row.
 * Memory use is independent of the number of facts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FactScanner {

    /** Rows between two checks of the worker's interrupt flag. */
    public static final int INTERRUPT_CHECK_INTERVAL = 4096;

    private final MetricsCollector metricsCollector;

    /** Callback of {@link #scan}. */
    public interface Visitor {

        /** Called for every fact inside the time ranges, before the other predicates. */
        default void inRange(ContractFact fact) {
        }

        /** Called for every fact passing all predicates. */
        void matched(ContractFact fact);
    }

    /**
     * Visits the facts of {@code plan}'s fact buckets in file order.
     *
     * @return facts read
     * @throws CancellationException when the calling thread is interrupted (query budget exceeded)
     */
    public long scan(Snapshot snapshot, QueryPlan plan, FilterChipSet chips, Visitor visitor) {
        long read = 0;
        try (FactCursor cursor = snapshot.openFacts(plan.factBuckets(), plan.includeSecondary())) {
            while (cursor.hasNext()) {
                ContractFact fact = cursor.next();
                if (++read % INTERRUPT_CHECK_INTERVAL == 0 && Thread.currentThread().isInterrupted()) {
                    log.info("[FACT-SCAN] Interrupted after {} rows", read);
                    throw new CancellationException("Scan interrupted after " + read + " rows");
                }
                if (!chips.matchesTime(fact.getAwardDate())) {
                    continue;
                }
                visitor.inRange(fact);
                if (chips.matchesNonTime(fact)) {
                    visitor.matched(fact);
                }
            }
        }
        metricsCollector.recordScan(read);
        log.debug("[FACT-SCAN] Read {} rows from {}{}", read, plan.factBuckets(), plan.includeSecondary() ? "+secondary" : "");
        return read;
    }

    /** Counts the facts passing every predicate. */
    public long count(Snapshot snapshot, QueryPlan plan, FilterChipSet chips) {
        long[] n = new long[1];
        scan(snapshot, plan, chips, fact -> n[0]++);
        return n[0];
    }

    /**
     * Lazily iterates the matching facts in file order, for exports. The caller must close the
     * returned iterator.
     */
    public MatchingFacts open(Snapshot snapshot, QueryPlan plan, FilterChipSet chips) {
        return new MatchingFacts(snapshot.openFacts(plan.factBuckets(), plan.includeSecondary()), chips);
    }

    /** Filtering view over a {@link FactCursor}. */
    public static final class MatchingFacts implements Iterator<ContractFact>, Closeable {

        private final FactCursor cursor;
        private final FilterChipSet chips;
        private ContractFact next;

        private MatchingFacts(FactCursor cursor, FilterChipSet chips) {
            this.cursor = cursor;
            this.chips = chips;
        }

        @Override
        public boolean hasNext() {
            while (next == null && cursor.hasNext()) {
                ContractFact candidate = cursor.next();
                if (chips.matches(candidate)) {
                    next = candidate;
                }
            }
            return next != null;
        }

        @Override
        public ContractFact next() {
            if (!hasNext()) throw new NoSuchElementException();
            ContractFact out = next;
            next = null;
            return out;
        }

        @Override
        public void close() {
            cursor.close();
        }
    }
}
