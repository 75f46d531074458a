package org.pragmatica.layout.solver;

import org.pragmatica.layout.fragment.Fragment;
import org.pragmatica.layout.fragment.Shape;
import org.pragmatica.layout.fragment.State;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A possibly partial assignment of states to the stateful fragments of a tree, along with the measured result of
 * rendering the tree that way.
 *
 * Fragments without a binding are rendered unsplit. Solutions order by cost, then overflow, then by the state values
 * of the fragments in pre-order, so that equal alternatives always resolve the same way.
 */
public final class Solution implements Comparable<Solution> {
    private final Solver solver;
    private final Fragment root;
    private final int startColumn;
    private final int indent;
    private final Set<Shape> allowedShapes;
    private final Map<Fragment, State> bindings;
    private final Map<Fragment, State> subtreeStates = new HashMap<>();

    private final String text;
    private final int cost;
    private final int overflow;
    private final boolean valid;
    private final Shape shape;
    private final Fragment expandCandidate;

    private int[] stateValues;

    private Solution(Solver solver,
                     Fragment root,
                     int startColumn,
                     int indent,
                     Set<Shape> allowedShapes,
                     Map<Fragment, State> bindings) {
        this.solver = solver;
        this.root = root;
        this.startColumn = startColumn;
        this.indent = indent;
        this.allowedShapes = allowedShapes;
        this.bindings = bindings;

        solver.counter().count("create Solution");

        var writer = new CodeWriter(solver, this, startColumn, indent);

        writer.renderRoot(root, allowedShapes);

        this.text = writer.text();
        this.cost = writer.cost();
        this.overflow = writer.overflow();
        this.valid = writer.isValid();
        this.shape = writer.shape();
        this.expandCandidate = writer.expandCandidate();
    }

    /**
     * Render {@code root} with the given bindings.
     *
     * @param startColumn column where the first line starts, or {@code -1} to start a fresh line at {@code indent}
     */
    static Solution solution(Solver solver,
                             Fragment root,
                             int startColumn,
                             int indent,
                             Set<Shape> allowedShapes,
                             Map<Fragment, State> bindings) {
        return new Solution(solver, root, startColumn, indent, allowedShapes, Map.copyOf(bindings));
    }

    public Fragment root() {
        return root;
    }

    public String text() {
        return text;
    }

    /**
     * Sum of the costs of every stateful fragment in its resolved state.
     */
    public int cost() {
        return cost;
    }

    /**
     * Total number of characters by which lines exceed the page width.
     */
    public int overflow() {
        return overflow;
    }

    public boolean fits() {
        return overflow == 0;
    }

    /**
     * Whether every fragment has a shape its parent allows in its resolved state.
     */
    public boolean isValid() {
        return valid;
    }

    /**
     * Shape of the rendered root.
     */
    public Shape shape() {
        return shape;
    }

    /**
     * The state {@code fragment} is resolved to: its pinned state, its binding, or unsplit.
     */
    public State stateOf(Fragment fragment) {
        return fragment.pinnedState()
                       .or(() -> Optional.ofNullable(bindings.get(fragment)))
                       .or(() -> Optional.ofNullable(subtreeStates.get(fragment)))
                       .orElse(State.UNSPLIT);
    }

    /**
     * Resolved state of every stateful fragment in the tree, in pre-order.
     */
    public Map<Fragment, State> assignment() {
        var assignment = new LinkedHashMap<Fragment, State>();

        for (var fragment : root.statefulOffspring()) {
            assignment.put(fragment, stateOf(fragment));
        }
        return Collections.unmodifiableMap(assignment);
    }

    @Override
    public int compareTo(Solution other) {
        if (cost != other.cost) {
            return Integer.compare(cost, other.cost);
        }
        if (overflow != other.overflow) {
            return Integer.compare(overflow, other.overflow);
        }
        return Arrays.compare(stateValues(), other.stateValues());
    }

    /**
     * Whether this solution is preferable to {@code other} as a final answer.
     *
     * A solution that fits the page beats one that does not. Between two that fit, the cheaper wins; between two that
     * do not, the one overflowing less wins.
     */
    public boolean isBetterThan(Solution other) {
        if (fits() != other.fits()) {
            return fits();
        }
        if (!fits() && overflow != other.overflow) {
            return overflow < other.overflow;
        }
        return compareTo(other) < 0;
    }

    @Override
    public String toString() {
        return "Solution[cost=" + cost + ", overflow=" + overflow + ", valid=" + valid + ", bindings=" + bindings + "]";
    }

    Map<Fragment, State> bindings() {
        return bindings;
    }

    boolean isBound(Fragment fragment) {
        return fragment.pinnedState().isPresent() || bindings.containsKey(fragment);
    }

    /**
     * The bindings of this solution that fall inside the subtree of {@code fragment}.
     */
    Map<Fragment, State> bindingsWithin(Fragment fragment) {
        var within = new HashMap<Fragment, State>();

        for (var offspring : fragment.statefulOffspring()) {
            var state = bindings.get(offspring);

            if (state != null) {
                within.put(offspring, state);
            }
        }
        return within;
    }

    void mergeSubtree(Solution subtree) {
        subtree.root.statefulOffspring()
                    .forEach(fragment -> subtreeStates.put(fragment, subtree.stateOf(fragment)));
    }

    /**
     * New solutions binding the next fragment worth trying to each of its states.
     */
    List<Solution> expand() {
        if (expandCandidate == null) {
            return List.of();
        }

        var expanded = new ArrayList<Solution>();

        for (var state : expandCandidate.allStates()) {
            var newBindings = new HashMap<>(bindings);

            if (tryBind(newBindings, expandCandidate, state)) {
                expanded.add(new Solution(solver, root, startColumn, indent, allowedShapes, newBindings));
            }
        }
        return expanded;
    }

    /**
     * Bind {@code fragment} to {@code state} along with every fragment that state constrains.
     *
     * Fails if a fragment would need two different states, or if a child that may only be inline is already known
     * to contain a newline.
     */
    static boolean tryBind(Map<Fragment, State> bindings, Fragment fragment, State state) {
        var pinned = fragment.pinnedState();

        if (pinned.isPresent()) {
            return pinned.get().equals(state);
        }

        var bound = bindings.get(fragment);

        if (bound != null) {
            return bound.equals(state);
        }

        bindings.put(fragment, state);

        for (var child : fragment.children()) {
            if (fragment.childShapeConstraint(state, child).equals(Shape.ONLY_INLINE)
                && knownState(bindings, child).map(child::forcesNewline)
                                              .orElse(child.containsHardNewline())) {
                return false;
            }
        }

        var constraints = new ArrayList<Map.Entry<Fragment, State>>();

        fragment.applyConstraints(state, (other, constrained) -> constraints.add(Map.entry(other, constrained)));

        for (var constraint : constraints) {
            if (!tryBind(bindings, constraint.getKey(), constraint.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static Optional<State> knownState(Map<Fragment, State> bindings, Fragment fragment) {
        return fragment.pinnedState()
                       .or(() -> Optional.ofNullable(bindings.get(fragment)));
    }

    private int[] stateValues() {
        if (stateValues == null) {
            var offspring = root.statefulOffspring();

            stateValues = new int[offspring.size()];

            for (int i = 0; i < offspring.size(); i++) {
                stateValues[i] = stateOf(offspring.get(i)).value();
            }
        }
        return stateValues;
    }
}
