package org.pragmatica.layout.fragment;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Base class for the formatter's internal representation used for line splitting.
 *
 * The construction phase converts a parsed program into a tree of fragments. The tree roughly follows the syntax tree
 * but is shaped for line splitting: every fragment declares the ways it may split ({@link #legalStates()}), what each
 * way costs, and which shapes its children may take. The solver then picks one state for every stateful fragment.
 *
 * Fragments are created bottom-up and never change structure afterwards. Once the tree is complete,
 * {@link #finalizeTree()} computes the size metrics the solver relies on. Reading a metric earlier is a usage error.
 */
public abstract class Fragment {
    /**
     * Receives a constraint that a fragment places on another fragment.
     */
    @FunctionalInterface
    public interface Constrain {
        void constrain(Fragment other, State state);
    }

    private State pinnedState;
    private Fragment parent;
    private boolean finalized;
    private boolean finalizing;
    private boolean containsHardNewline;
    private int totalCharacters;
    private List<Fragment> statefulOffspring;

    protected Fragment(FragmentCounter counter) {
        counter.count("create " + debugName());
    }

    /**
     * Additional ways this fragment can split, beyond the implicit {@link State#UNSPLIT}.
     *
     * The returned list must be strictly ascending and must be the same list on every call. Unsplittable fragments
     * return an empty list.
     */
    public List<State> legalStates() {
        return List.of();
    }

    /**
     * {@link State#UNSPLIT} followed by {@link #legalStates()}.
     */
    public final List<State> allStates() {
        var states = legalStates();
        var result = new ArrayList<State>(states.size() + 1);

        result.add(State.UNSPLIT);
        result.addAll(states);
        return result;
    }

    public final boolean isStateful() {
        return !legalStates().isEmpty();
    }

    /**
     * The cost this fragment adds to a solution when in {@code state}.
     */
    public int cost(State state) {
        return state.cost();
    }

    /**
     * Shapes {@code child} may take while this fragment is in {@code state}.
     */
    public Set<Shape> childShapeConstraint(State state, Fragment child) {
        return Shape.ALL;
    }

    /**
     * Whether this fragment always writes at least one newline, itself or through a child, when in {@code state}.
     *
     * Returns {@code false} if the fragment only might contain a newline in that state.
     */
    public boolean forcesNewline(State state) {
        return !state.equals(State.UNSPLIT) || containsHardNewline();
    }

    /**
     * Report the constraints this fragment places on other fragments when bound to {@code state}.
     */
    public void applyConstraints(State state, Constrain constrain) {}

    /**
     * The state this fragment will always end up in at {@code pageWidth}, if its size metrics alone prove it.
     *
     * This is purely an optimization: the solver pins the returned state before searching. Returning a state the
     * search would not have picked is a bug; returning empty is always safe.
     */
    public Optional<State> eagerState(int pageWidth) {
        return Optional.empty();
    }

    /**
     * Write this fragment in {@code state}.
     */
    public abstract void render(FragmentWriter writer, State state);

    /**
     * Direct children in rendering order.
     */
    public abstract List<Fragment> children();

    /**
     * Characters this fragment writes itself, not counting its children.
     */
    protected int ownCharacters() {
        return 0;
    }

    /**
     * Whether this fragment has an explicit mandatory newline of its own.
     */
    protected boolean hasOwnHardNewline() {
        return false;
    }

    public final Optional<State> pinnedState() {
        return Optional.ofNullable(pinnedState);
    }

    /**
     * Force this fragment to always use {@code state}.
     *
     * Only the first pin takes effect. Fragments constrained by the pinned state are pinned as well, recursively.
     *
     * @throws IllegalArgumentException if this fragment has no such state
     */
    public final void pin(State state) {
        if (!allStates().contains(state)) {
            throw new IllegalArgumentException(this + " has no state " + state + ", expected one of " + allStates());
        }
        if (pinnedState != null) {
            return;
        }

        pinnedState = state;
        applyConstraints(state, Fragment::pin);
    }

    /**
     * Pin the state that keeps this fragment from splitting.
     */
    public void preventSplit() {
        pin(State.UNSPLIT);
    }

    public final boolean isFinalized() {
        return finalized;
    }

    /**
     * Whether another fragment owns this one as a child.
     */
    public final boolean hasParent() {
        return parent != null;
    }

    /**
     * Compute the size metrics of this fragment and its whole subtree, children before parents.
     *
     * Must be called once the tree is complete. Calling it again is a no-op.
     *
     * @throws IllegalStateException if a fragment is a child of more than one parent or its own descendant
     * @throws IllegalArgumentException if a fragment declares unordered states
     */
    public final void finalizeTree() {
        if (finalized) {
            return;
        }
        if (finalizing) {
            throw new IllegalStateException(this + " is its own descendant");
        }

        finalizing = true;

        var hardNewline = hasOwnHardNewline();
        var characters = ownCharacters();
        var offspring = new ArrayList<Fragment>();

        State.ascending(legalStates());

        if (isStateful()) {
            offspring.add(this);
        }

        for (var child : children()) {
            child.attachTo(this);
            child.finalizeTree();

            hardNewline |= child.containsHardNewline;
            characters += child.totalCharacters;
            offspring.addAll(child.statefulOffspring);
        }

        containsHardNewline = hardNewline;
        totalCharacters = characters;
        statefulOffspring = List.copyOf(offspring);
        finalizing = false;
        finalized = true;
    }

    /**
     * Whether this fragment or any descendant contains an explicit mandatory newline.
     */
    public final boolean containsHardNewline() {
        checkFinalized();
        return containsHardNewline;
    }

    /**
     * Number of characters in this fragment and all its descendants, ignoring splitting.
     */
    public final int totalCharacters() {
        checkFinalized();
        return totalCharacters;
    }

    /**
     * This fragment and all its descendants that have more than the {@link State#UNSPLIT} state, in pre-order.
     */
    public final List<Fragment> statefulOffspring() {
        checkFinalized();
        return statefulOffspring;
    }

    /**
     * The name of this fragment in debug output: the class name without the {@code Fragment} suffix.
     */
    public String debugName() {
        return getClass().getSimpleName().replace("Fragment", "");
    }

    @Override
    public String toString() {
        return pinnedState == null ? debugName() : debugName() + "!" + pinnedState;
    }

    private void attachTo(Fragment owner) {
        if (parent != null && parent != owner) {
            throw new IllegalStateException(this + " is already a child of " + parent + ", cannot attach to " + owner);
        }
        if (owner == this) {
            throw new IllegalStateException(this + " cannot be its own child");
        }
        parent = owner;
    }

    private void checkFinalized() {
        if (!finalized) {
            throw new IllegalStateException("Metrics of " + this + " read before finalizeTree()");
        }
    }
}
