package org.pragmatica.layout.solver;

import org.pragmatica.layout.fragment.Fragment;
import org.pragmatica.layout.fragment.Shape;
import org.pragmatica.layout.fragment.State;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Memoized solutions of subtrees that are formatted independently of their surroundings.
 *
 * A subtree written on its own lines depends only on where it starts, how deep it is indented, which of its
 * fragments are already bound and which shapes its parent accepts.
 */
final class SolutionCache {
    private final Map<Key, Solution> solutions = new HashMap<>();

    Optional<Solution> find(Fragment root, int startColumn, int indent, Map<Fragment, State> bindings, Set<Shape> shapes) {
        return Optional.ofNullable(solutions.get(key(root, startColumn, indent, bindings, shapes)));
    }

    void store(Fragment root, int startColumn, int indent, Map<Fragment, State> bindings, Set<Shape> shapes,
               Solution solution) {
        solutions.put(key(root, startColumn, indent, bindings, shapes), solution);
    }

    int size() {
        return solutions.size();
    }

    private static Key key(Fragment root, int startColumn, int indent, Map<Fragment, State> bindings, Set<Shape> shapes) {
        return new Key(root, startColumn, indent, Map.copyOf(bindings), Set.copyOf(shapes));
    }

    // Fragments compare by identity, so two equal-looking subtrees never share a solution.
    private record Key(Fragment root, int startColumn, int indent, Map<Fragment, State> bindings, Set<Shape> shapes) {}
}
