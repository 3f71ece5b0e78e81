package org.tabula.indent;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * An ordered map from non-negative positions (breakpoints) to values. The value of
 * a breakpoint governs every position from that breakpoint up to, but excluding, the
 * next one.
 *
 * @param <V> The value type.
 */
public final class IntervalStore<V> {

    private final TreeMap<Integer, V> breakpoints = new TreeMap<>();

    /**
     * Sets the value at a breakpoint, replacing any value already stored there.
     * @param key The position, not negative.
     * @param value The value.
     */
    public void insertBreakpoint(int key, V value) {
        if (key < 0) {
            throw new IllegalArgumentException("Breakpoint must not be negative: " + key);
        }
        breakpoints.put(key, value);
    }

    /**
     * Finds the value governing a position.
     * @param key The position, not negative.
     * @return The value stored at the largest breakpoint not greater than {@code key},
     *         or null if there is none.
     */
    public V findFloor(int key) {
        if (key < 0) {
            throw new IllegalArgumentException("Position must not be negative: " + key);
        }
        Map.Entry<Integer, V> entry = breakpoints.floorEntry(key);
        return entry == null ? null : entry.getValue();
    }

    /**
     * Removes every breakpoint strictly between {@code start} and {@code end}.
     * Nothing happens when {@code start >= end}.
     */
    public void deleteRange(int start, int end) {
        if (start >= end) {
            return;
        }
        breakpoints.subMap(start, false, end, false).clear();
    }

    /**
     * @return A read-only ordered view of the breakpoints.
     */
    public NavigableMap<Integer, V> breakpoints() {
        return Collections.unmodifiableNavigableMap(breakpoints);
    }

    /**
     * @return The number of breakpoints.
     */
    public int size() {
        return breakpoints.size();
    }
}
