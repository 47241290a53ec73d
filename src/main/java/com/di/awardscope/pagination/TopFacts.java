package com.di.awardscope.pagination;

import com.di.awardscope.snapshot.ContractFact;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Keeps the first {@code capacity} facts of the raw search order (amount desc, reference id asc)
 * while counting every offered fact. Memory is bounded by the capacity. Not thread-safe.
 */
public final class TopFacts {

    /** Raw fact search order. */
    public static final Comparator<ContractFact> ORDER =
            Comparator.comparingDouble(ContractFact::getContractAmount).reversed()
                    .thenComparing(ContractFact::getReferenceId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final int capacity;
    // Worst kept fact at the head.
    private final PriorityQueue<ContractFact> heap;
    private long offered;

    public TopFacts(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative");
        }
        this.capacity = capacity;
        this.heap = new PriorityQueue<>(Math.max(1, Math.min(capacity, 1024)), ORDER.reversed());
    }

    public void offer(ContractFact fact) {
        offered++;
        if (capacity == 0) {
            return;
        }
        if (heap.size() < capacity) {
            heap.add(fact);
        } else if (ORDER.compare(fact, heap.peek()) < 0) {
            heap.poll();
            heap.add(fact);
        }
    }

    /** The window {@code [offset, offset + limit)} of the kept facts; {@code offset + limit} must not exceed the capacity. */
    public Page<ContractFact> page(int offset, int limit) {
        List<ContractFact> sorted = new ArrayList<>(heap);
        sorted.sort(ORDER);
        int from = Math.min(offset, sorted.size());
        int to = Math.min(offset + limit, sorted.size());
        return new Page<>(sorted.subList(from, to), offered, offset, limit, (long) offset + limit < offered);
    }
}
