package org.pragmatica.layout;

import org.pragmatica.layout.fragment.Fragment;
import org.pragmatica.layout.fragment.State;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of laying out a fragment tree.
 *
 * @param text       formatted code
 * @param cost       total cost of the chosen states
 * @param overflow   total number of characters beyond the page width, zero if everything fits
 * @param assignment chosen state of every stateful fragment, in pre-order
 */
public record FormattedLayout(String text, int cost, int overflow, Map<Fragment, State> assignment) {
    public FormattedLayout {
        assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
    }

    public boolean fits() {
        return overflow == 0;
    }

    /**
     * The state chosen for {@code fragment}, or {@link State#UNSPLIT} for a fragment that cannot split.
     */
    public State stateOf(Fragment fragment) {
        return assignment.getOrDefault(fragment, State.UNSPLIT);
    }
}
