package org.pragmatica.layout.fragment;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A delimited, separator-joined list such as an argument list or a collection literal.
 *
 * Unsplit, the whole list stays on one line:
 *
 * <pre>
 * (first, second)
 * </pre>
 *
 * Split, every element goes on its own indented line and the list is block shaped:
 *
 * <pre>
 * (
 *     first,
 *     second
 * )
 * </pre>
 *
 * An empty list never splits.
 */
public final class ListFragment extends Fragment {
    private final String opening;
    private final String closing;
    private final String separator;
    private final List<Fragment> elements;
    private final List<State> states;

    ListFragment(FragmentCounter counter, String opening, String closing, String separator, List<Fragment> elements) {
        super(counter);
        this.opening = opening;
        this.closing = closing;
        this.separator = separator;
        this.elements = List.copyOf(elements);
        this.states = this.elements.isEmpty()
                      ? List.of()
                      : State.ascending(List.of(State.FULL_SPLIT));
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public List<State> legalStates() {
        return states;
    }

    @Override
    public Set<Shape> childShapeConstraint(State state, Fragment child) {
        return Shape.anyIf(!state.equals(State.UNSPLIT));
    }

    @Override
    public Optional<State> eagerState(int pageWidth) {
        // An element with a mandatory newline can never sit on the list's single line.
        var mustSplit = elements.stream()
                                .anyMatch(Fragment::containsHardNewline);

        return mustSplit ? Optional.of(State.FULL_SPLIT) : Optional.empty();
    }

    @Override
    public void render(FragmentWriter writer, State state) {
        writer.write(opening);

        if (state.equals(State.UNSPLIT)) {
            for (int i = 0; i < elements.size(); i++) {
                if (i > 0) {
                    writer.write(separator);
                    writer.space();
                }
                writer.render(elements.get(i));
            }
        } else {
            writer.setShapeMode(ShapeMode.BLOCK);
            writer.indented(Indent.BLOCK, () -> {
                for (int i = 0; i < elements.size(); i++) {
                    writer.newline();
                    writer.render(elements.get(i));

                    if (i < elements.size() - 1) {
                        writer.write(separator);
                    }
                }
            });
            writer.newline();
        }

        writer.write(closing);
    }

    @Override
    public List<Fragment> children() {
        return elements;
    }

    @Override
    protected int ownCharacters() {
        var separators = Math.max(0, elements.size() - 1) * (separator.length() + 1);

        return opening.length() + closing.length() + separators;
    }
}
