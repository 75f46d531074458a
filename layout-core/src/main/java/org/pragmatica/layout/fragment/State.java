package org.pragmatica.layout.fragment;

import java.util.List;

/**
 * One discrete way a fragment may be laid out.
 *
 * The value orders states within a fragment; each fragment kind interprets its own values. Only {@link #UNSPLIT} and
 * {@link #FULL_SPLIT} carry the same meaning across kinds.
 *
 * States order by value alone, while equality compares all components, so the natural ordering is inconsistent with
 * {@code equals}. Fragments never declare two states with the same value, so within one fragment the two agree.
 *
 * @param value ordering key, unique within a fragment kind
 * @param cost  penalty added to a solution choosing this state
 * @param name  name shown in debug output
 */
public record State(int value, int cost, String name) implements Comparable<State> {
    /**
     * Everything on one line. Implicitly the first state of every fragment.
     */
    public static final State UNSPLIT = new State(0, 0, "unsplit");

    /**
     * Split everywhere the fragment can split. Larger than any other state value.
     */
    public static final State FULL_SPLIT = new State(255, 1, "split");

    public State {
        if (value < 0) {
            throw new IllegalArgumentException("State value must not be negative: " + value);
        }
        if (cost < 0) {
            throw new IllegalArgumentException("State cost must not be negative: " + cost);
        }
    }

    /**
     * Factory method.
     */
    public static State state(int value, int cost, String name) {
        return new State(value, cost, name);
    }

    /**
     * Check a declared list of additional states and return it unmodifiable.
     *
     * The list must be strictly ascending by value and must not contain {@link #UNSPLIT}, which every fragment has
     * implicitly.
     *
     * @throws IllegalArgumentException if the list breaks either rule
     */
    public static List<State> ascending(List<State> states) {
        var previous = UNSPLIT;

        for (var state : states) {
            if (state.value <= previous.value) {
                throw new IllegalArgumentException("States must be strictly ascending and exclude unsplit: " + states);
            }
            previous = state;
        }

        return List.copyOf(states);
    }

    @Override
    public int compareTo(State other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return name + "(" + value + ")";
    }
}
