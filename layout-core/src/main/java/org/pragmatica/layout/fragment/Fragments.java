package org.pragmatica.layout.fragment;

import org.pragmatica.layout.chain.ChainFragment;

import java.util.List;

/**
 * Creates fragments, reporting each creation to one {@link FragmentCounter}.
 *
 * The construction phase that walks a parsed program uses one instance per tree.
 */
public final class Fragments {
    private final FragmentCounter counter;

    private Fragments(FragmentCounter counter) {
        this.counter = counter;
    }

    /**
     * Factory method for a factory that counts nothing.
     */
    public static Fragments fragments() {
        return new Fragments(FragmentCounter.none());
    }

    public static Fragments fragments(FragmentCounter counter) {
        return new Fragments(counter);
    }

    public FragmentCounter counter() {
        return counter;
    }

    public TextFragment text(String text) {
        return new TextFragment(counter, text);
    }

    public AdjacentFragment adjacent(Fragment... fragments) {
        return adjacent(List.of(fragments));
    }

    public AdjacentFragment adjacent(List<Fragment> fragments) {
        return new AdjacentFragment(counter, fragments);
    }

    public ListFragment list(String opening, String closing, String separator, List<Fragment> elements) {
        return new ListFragment(counter, opening, closing, separator, elements);
    }

    /**
     * A parenthesized, comma separated argument list.
     */
    public ListFragment arguments(Fragment... arguments) {
        return list("(", ")", ",", List.of(arguments));
    }

    public InfixFragment infix(List<Fragment> operands, List<String> operators) {
        return new InfixFragment(counter, operands, operators);
    }

    public BlockFragment block(Fragment... statements) {
        return new BlockFragment(counter, List.of(statements));
    }

    /**
     * Start a dotted chain of calls on {@code target}.
     */
    public ChainFragment.Builder chain(Fragment target) {
        return ChainFragment.builder(counter, target);
    }
}
