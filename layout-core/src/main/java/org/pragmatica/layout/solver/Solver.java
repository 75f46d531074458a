package org.pragmatica.layout.solver;

import org.pragmatica.layout.LayoutConfig;
import org.pragmatica.layout.fragment.Fragment;
import org.pragmatica.layout.fragment.FragmentCounter;
import org.pragmatica.layout.fragment.Shape;
import org.pragmatica.layout.fragment.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Selects a state for every stateful fragment of a tree so that the output fits the page at the lowest cost.
 *
 * The search starts from the solution where only fragments forced by their size are bound and every other fragment
 * is unsplit. Each solution that
 * overflows or breaks a shape constraint is expanded by binding one fragment, chosen by the writer, to each of its
 * states. Solutions are explored cheapest first, so the first solution that fits the page is the cheapest one that
 * does. Subtrees written on their own lines are solved separately and memoized.
 *
 * A solver holds the memoized subtree solutions of one tree and is not thread-safe.
 */
public final class Solver {
    private static final Logger log = LoggerFactory.getLogger(Solver.class);

    private final LayoutConfig config;
    private final FragmentCounter counter;
    private final SolutionCache cache = new SolutionCache();

    private Solver(LayoutConfig config, FragmentCounter counter) {
        this.config = config;
        this.counter = counter;
    }

    public static Solver solver(LayoutConfig config) {
        return new Solver(config, FragmentCounter.none());
    }

    public static Solver solver(LayoutConfig config, FragmentCounter counter) {
        return new Solver(config, counter);
    }

    /**
     * Solve {@code root} with the default configuration at the given page width.
     */
    public static Solution solve(Fragment root, int pageWidth) {
        return solver(LayoutConfig.layoutConfig(pageWidth)).solve(root);
    }

    public LayoutConfig config() {
        return config;
    }

    FragmentCounter counter() {
        return counter;
    }

    /**
     * Find the best layout of {@code root}, which must be finalized.
     *
     * Fragments whose state follows from their size alone are bound before searching. The result depends only on
     * the tree, its pinned states and the configuration, so solving the same tree again gives the same layout.
     *
     * @throws IllegalStateException if the tree is not finalized or no assignment satisfies its shape constraints
     */
    public Solution solve(Fragment root) {
        if (!root.isFinalized()) {
            throw new IllegalStateException("Tree rooted at " + root + " must be finalized before solving");
        }

        var solution = search(root, -1, config.leadingIndent(), eagerBindings(root), Shape.ALL);

        if (!solution.isValid()) {
            throw new IllegalStateException("No assignment of states satisfies the shape constraints of " + root);
        }

        log.debug("Solved {} with cost {} and overflow {}, {} subtree solutions cached",
                  root,
                  solution.cost(),
                  solution.overflow(),
                  cache.size());
        return solution;
    }

    /**
     * Solve a subtree starting at {@code startColumn} with following lines at {@code indent}, reusing a previous
     * result for the same context.
     */
    Solution solveSubtree(Fragment root, int startColumn, int indent, Map<Fragment, State> bindings, Set<Shape> shapes) {
        var cached = cache.find(root, startColumn, indent, bindings, shapes);

        if (cached.isPresent()) {
            counter.count("reuse Solution");
            return cached.get();
        }

        // Not computeIfAbsent: solving a subtree may solve and store nested subtrees.
        var solution = search(root, startColumn, indent, bindings, shapes);

        cache.store(root, startColumn, indent, bindings, shapes, solution);
        return solution;
    }

    /**
     * Bindings for the fragments whose state follows from their size alone, closed under their constraints.
     *
     * The bindings belong to this solve only; the tree itself is left untouched.
     */
    private Map<Fragment, State> eagerBindings(Fragment root) {
        var eager = new HashMap<Fragment, State>();

        for (var fragment : root.statefulOffspring()) {
            if (fragment.pinnedState().isPresent() || eager.containsKey(fragment)) {
                continue;
            }

            var state = fragment.eagerState(config.pageWidth());

            if (state.isEmpty()) {
                continue;
            }

            var attempt = new HashMap<>(eager);

            if (Solution.tryBind(attempt, fragment, state.get())) {
                log.trace("Eagerly bound {} to {}", fragment, state.get());
                eager = attempt;
            }
        }
        return eager;
    }

    private Solution search(Fragment root, int startColumn, int indent, Map<Fragment, State> bindings, Set<Shape> shapes) {
        var queue = new PriorityQueue<Solution>();
        var seen = new HashSet<Map<Fragment, State>>();
        var initial = Solution.solution(this, root, startColumn, indent, shapes, bindings);

        queue.add(initial);
        seen.add(initial.bindings());

        Solution best = null;
        var attempts = 0;

        while (!queue.isEmpty()) {
            var solution = queue.poll();

            attempts++;

            // Every remaining solution costs more than one that already fits.
            if (best != null && best.fits() && solution.cost() > best.cost()) {
                break;
            }

            log.trace("Attempt {}: {}", attempts, solution);

            if (solution.isValid() && (best == null || solution.isBetterThan(best))) {
                best = solution;
            }
            if (solution.isValid() && solution.fits()) {
                continue;
            }
            if (attempts >= config.maxAttempts()) {
                log.warn("Gave up on {} after {} attempts, using best solution found so far", root, attempts);
                break;
            }

            for (var expanded : solution.expand()) {
                if (seen.add(expanded.bindings())) {
                    queue.add(expanded);
                }
            }
        }

        if (best == null) {
            log.debug("No valid solution for {} after {} attempts, splitting everything", root, attempts);
            best = splitEverything(root, startColumn, indent, bindings, shapes);
        }

        return best;
    }

    /**
     * The solution where every fragment not yet bound takes its last state, as far as constraints allow.
     */
    private Solution splitEverything(Fragment root, int startColumn, int indent, Map<Fragment, State> bindings,
                                     Set<Shape> shapes) {
        var split = new HashMap<>(bindings);

        for (var fragment : root.statefulOffspring()) {
            var states = fragment.legalStates();
            var attempt = new HashMap<>(split);

            if (Solution.tryBind(attempt, fragment, states.get(states.size() - 1))) {
                split = attempt;
            }
        }

        return Solution.solution(this, root, startColumn, indent, shapes, split);
    }
}
