package com.hindsight.core.model;

import com.hindsight.core.exception.DataInconsistencyException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.TreeSet;

/**
 * Time-ordered bars with lookups bounded by a point in time.
 *
 * Timestamps must be strictly increasing; anything else is rejected on construction.
 */
public final class BarSeries {

    private final String name;
    private final List<Bar> bars;
    private final long[] times;

    public BarSeries(String name, List<Bar> bars) {
        this.name = name;
        this.bars = List.copyOf(bars);
        this.times = new long[this.bars.size()];
        for (int i = 0; i < times.length; i++) {
            times[i] = this.bars.get(i).timestamp();
            if (i > 0 && times[i] <= times[i - 1]) {
                throw new DataInconsistencyException(String.format(
                    "%s: bars not strictly increasing at index %d (%s after %s)",
                    name, i, Instant.ofEpochMilli(times[i]), Instant.ofEpochMilli(times[i - 1])));
            }
        }
    }

    public String name() {
        return name;
    }

    public int size() {
        return times.length;
    }

    public boolean isEmpty() {
        return times.length == 0;
    }

    public Bar get(int index) {
        return bars.get(index);
    }

    /**
     * Index of the last bar with timestamp at or before {@code time}, or -1 if none.
     */
    public int indexAtOrBefore(Instant time) {
        int pos = Arrays.binarySearch(times, time.toEpochMilli());
        return pos >= 0 ? pos : -pos - 2;
    }

    /**
     * Last bar visible at {@code time}, or null if none yet.
     */
    public Bar latestAt(Instant time) {
        int index = indexAtOrBefore(time);
        return index >= 0 ? bars.get(index) : null;
    }

    /**
     * Up to {@code count} bars visible at {@code time}, oldest first.
     */
    public List<Bar> lastAt(Instant time, int count) {
        int end = indexAtOrBefore(time) + 1;
        int start = Math.max(0, end - count);
        return bars.subList(start, end);
    }

    public List<Instant> timestamps() {
        List<Instant> result = new ArrayList<>(times.length);
        for (long t : times) {
            result.add(Instant.ofEpochMilli(t));
        }
        return result;
    }

    /**
     * Timestamps present in every series, ascending. Empty when no series is given.
     */
    public static List<Instant> commonTimestamps(Collection<BarSeries> series) {
        Iterator<BarSeries> it = series.iterator();
        if (!it.hasNext()) {
            return List.of();
        }
        TreeSet<Instant> common = new TreeSet<>(it.next().timestamps());
        while (it.hasNext() && !common.isEmpty()) {
            common.retainAll(new TreeSet<>(it.next().timestamps()));
        }
        return List.copyOf(common);
    }
}
