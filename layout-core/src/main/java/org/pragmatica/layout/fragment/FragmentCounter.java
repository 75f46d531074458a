package org.pragmatica.layout.fragment;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collects counts of construction and search events for profiling.
 */
public interface FragmentCounter {
    FragmentCounter NONE = event -> {};

    void count(String event);

    /**
     * Counter that discards everything.
     */
    static FragmentCounter none() {
        return NONE;
    }

    /**
     * Counter that keeps a tally per event name.
     */
    static Counting counting() {
        return new Counting();
    }

    final class Counting implements FragmentCounter {
        private final Map<String, Integer> counts = new TreeMap<>();

        private Counting() {}

        @Override
        public void count(String event) {
            counts.merge(event, 1, Integer::sum);
        }

        public int countOf(String event) {
            return counts.getOrDefault(event, 0);
        }

        /**
         * Snapshot of all counts, sorted by event name.
         */
        public Map<String, Integer> counts() {
            return Collections.unmodifiableMap(new TreeMap<>(counts));
        }
    }
}
