package org.pragmatica.layout.fragment;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A series of operands joined by binary operators, such as {@code a + b + c}.
 *
 * When split, every operator ends its line and the following operands are indented:
 *
 * <pre>
 * first +
 *         second +
 *         third
 * </pre>
 */
public final class InfixFragment extends Fragment {
    private static final List<State> STATES = State.ascending(List.of(State.FULL_SPLIT));

    private final List<Fragment> operands;
    private final List<String> operators;

    InfixFragment(FragmentCounter counter, List<Fragment> operands, List<String> operators) {
        super(counter);

        if (operands.size() < 2) {
            throw new IllegalArgumentException("Infix sequence needs at least two operands, got " + operands.size());
        }
        if (operators.size() != operands.size() - 1) {
            throw new IllegalArgumentException("Expected " + (operands.size() - 1) + " operators, got " + operators.size());
        }

        this.operands = List.copyOf(operands);
        this.operators = List.copyOf(operators);
    }

    @Override
    public List<State> legalStates() {
        return STATES;
    }

    @Override
    public Set<Shape> childShapeConstraint(State state, Fragment child) {
        return Shape.anyIf(!state.equals(State.UNSPLIT));
    }

    @Override
    public Optional<State> eagerState(int pageWidth) {
        var mustSplit = totalCharacters() > pageWidth
                        || operands.stream()
                                   .anyMatch(Fragment::containsHardNewline);

        return mustSplit ? Optional.of(State.FULL_SPLIT) : Optional.empty();
    }

    @Override
    public void render(FragmentWriter writer, State state) {
        writer.render(operands.get(0));

        if (state.equals(State.UNSPLIT)) {
            for (int i = 1; i < operands.size(); i++) {
                writer.space();
                writer.write(operators.get(i - 1));
                writer.space();
                writer.render(operands.get(i));
            }
            return;
        }

        writer.indented(Indent.EXPRESSION, () -> {
            for (int i = 1; i < operands.size(); i++) {
                writer.space();
                writer.write(operators.get(i - 1));
                writer.newline();
                writer.render(operands.get(i));
            }
        });
    }

    @Override
    public List<Fragment> children() {
        return operands;
    }

    @Override
    protected int ownCharacters() {
        return operators.stream()
                        .mapToInt(operator -> operator.length() + 2)
                        .sum();
    }
}
