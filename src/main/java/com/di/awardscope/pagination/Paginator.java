package com.di.awardscope.pagination;

import com.di.awardscope.aggregate.AggregateRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Imposes the total order of a {@link SortSpec} on merged rows and serves windows of it.
 * Ranks are 1-based and contiguous: any two windows over the same rows and sort agree on every
 * rank they share.
 */
@Slf4j
@Component
public class Paginator {

    public List<AggregateRow> sort(List<AggregateRow> rows, SortSpec sort) {
        List<AggregateRow> sorted = new ArrayList<>(rows);
        sorted.sort(sort.comparator());
        return sorted;
    }

    /** Offset/limit window; ranks are {@code offset + 1 ..}. */
    public Page<RankedAggregate> page(List<AggregateRow> rows, SortSpec sort, int offset, int limit) {
        List<AggregateRow> sorted = sort(rows, sort);
        int from = Math.min(offset, sorted.size());
        int to = (int) Math.min((long) offset + limit, sorted.size());
        List<RankedAggregate> window = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
            window.add(new RankedAggregate(i + 1, sorted.get(i)));
        }
        log.debug("[PAGINATE] {} rows sorted by {}; window {}..{}", sorted.size(), sort, from + 1, to);
        return new Page<>(window, sorted.size(), offset, limit, to < sorted.size());
    }

    public Page<RankedAggregate> rankRange(List<AggregateRow> rows, SortSpec sort, RankRange range) {
        return page(rows, sort, range.offset(), range.size());
    }

    /**
     * Lazy ranked sequence over {@code range} (the whole result when {@code null}). Rows are sorted
     * once up front; ranks are assigned as the iterator advances.
     */
    public Iterator<RankedAggregate> rankedSequence(List<AggregateRow> rows, SortSpec sort, RankRange range) {
        List<AggregateRow> sorted = sort(rows, sort);
        int from = range != null ? Math.min(range.offset(), sorted.size()) : 0;
        int to = range != null ? (int) Math.min((long) range.to(), sorted.size()) : sorted.size();
        return new Iterator<>() {
            private int next = from;

            @Override
            public boolean hasNext() {
                return next < to;
            }

            @Override
            public RankedAggregate next() {
                if (next >= to) throw new NoSuchElementException();
                RankedAggregate out = new RankedAggregate(next + 1, sorted.get(next));
                next++;
                return out;
            }
        };
    }

    /** Rows a ranked window would hold, without sorting. */
    public static int windowSize(int total, RankRange range) {
        if (range == null) return total;
        return Math.max(0, Math.min(range.to(), total) - range.offset());
    }
}
