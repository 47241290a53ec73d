package com.di.awardscope.pagination;

/**
 * 1-based inclusive window of ranks, e.g. ranks 101..200.
 */
public record RankRange(int from, int to) {

    public RankRange {
        if (from < 1 || to < from) {
            throw new IllegalArgumentException("invalid rank range " + from + ".." + to);
        }
    }

    public int size() {
        return to - from + 1;
    }

    public int offset() {
        return from - 1;
    }

    @Override
    public String toString() {
        return from + ".." + to;
    }
}
