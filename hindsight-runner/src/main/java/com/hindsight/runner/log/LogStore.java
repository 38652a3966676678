package com.hindsight.runner.log;

import org.apache.logging.log4j.Level;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded in-memory record of backtest log events.
 *
 * <p>Each entry keeps its level, the simulated time it was logged at and its message as
 * separate fields. Reads only return entries at or above the store level, so raising the
 * level hides entries already captured.
 */
public class LogStore {

    private static final int DEFAULT_CAPACITY = 5000;
    private static final LogStore INSTANCE = new LogStore(DEFAULT_CAPACITY);

    /**
     * One captured event. {@code simTime} is null for events logged outside a run step.
     */
    public record Entry(Level level, String simTime, String loggerName, String message) {

        public String format() {
            String prefix = simTime != null ? "[" + simTime + "] " : "";
            return prefix + level + " " + loggerName + " - " + message;
        }
    }

    private final int capacity;
    private final Deque<Entry> entries = new ArrayDeque<>();
    private Level level = Level.ALL;

    public LogStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, was " + capacity);
        }
        this.capacity = capacity;
    }

    public static LogStore getInstance() {
        return INSTANCE;
    }

    public synchronized void add(Entry entry) {
        entries.addLast(entry);
        if (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    public synchronized void setLevel(Level level) {
        this.level = level;
    }

    public synchronized Level getLevel() {
        return level;
    }

    /**
     * The most recent {@code n} visible entries, oldest first.
     */
    public synchronized List<Entry> lastEntries(int n) {
        List<Entry> visible = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.level().isMoreSpecificThan(level)) {
                visible.add(entry);
            }
        }
        return new ArrayList<>(visible.subList(Math.max(0, visible.size() - n), visible.size()));
    }

    public List<String> lastLines(int n) {
        return lastEntries(n).stream().map(Entry::format).toList();
    }

    /**
     * Visible entries logged at {@code simTime}, as recorded from the run's MDC.
     */
    public synchronized List<Entry> entriesAt(String simTime) {
        return entries.stream()
            .filter(e -> simTime.equals(e.simTime()) && e.level().isMoreSpecificThan(level))
            .toList();
    }

    /** Number of visible entries. */
    public synchronized int size() {
        return (int) entries.stream().filter(e -> e.level().isMoreSpecificThan(level)).count();
    }

    public synchronized void clear() {
        entries.clear();
    }
}
