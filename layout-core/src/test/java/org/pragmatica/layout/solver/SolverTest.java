package org.pragmatica.layout.solver;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.pragmatica.layout.LayoutConfig;
import org.pragmatica.layout.chain.CallKind;
import org.pragmatica.layout.chain.ChainFragment;
import org.pragmatica.layout.fragment.Fragment;
import org.pragmatica.layout.fragment.FragmentCounter;
import org.pragmatica.layout.fragment.FragmentWriter;
import org.pragmatica.layout.fragment.Fragments;
import org.pragmatica.layout.fragment.Shape;
import org.pragmatica.layout.fragment.State;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SolverTest {
    private final FragmentCounter.Counting counter = FragmentCounter.counting();
    private final Fragments fragments = Fragments.fragments(counter);

    private ChainFragment chain() {
        return fragments.chain(fragments.text("target"))
                        .property(fragments.text(".getter"))
                        .call(fragments.text(".method(arg)"), CallKind.SPLITTABLE_CALL)
                        .property(fragments.text(".another"))
                        .call(fragments.text(".method(arg)"), CallKind.SPLITTABLE_CALL)
                        .build();
    }

    private Fragment call(String name, String... arguments) {
        return fragments.adjacent(fragments.text(name),
                                  fragments.arguments(Arrays.stream(arguments)
                                                            .map(fragments::text)
                                                            .toArray(Fragment[]::new)));
    }

    @Nested
    class Search {

        @Test
        void solve_assignsEveryStatefulFragment() {
            var root = fragments.adjacent(call("first", "a", "b"), fragments.text(" + "), call("second", "c"));

            root.finalizeTree();
            var solution = Solver.solve(root, 80);

            assertThat(solution.assignment()).containsOnlyKeys(root.statefulOffspring())
                                             .allSatisfy((fragment, state) -> assertThat(state).isEqualTo(State.UNSPLIT));
            assertThat(solution.isValid()).isTrue();
            assertThat(solution.fits()).isTrue();
        }

        @Test
        void solve_splitsOnlyWhatOverflows() {
            var first = call("first", "alpha", "beta");
            var second = call("second", "gamma");
            var root = fragments.block(first, second);

            root.finalizeTree();
            var solution = Solver.solve(root, 20);

            assertThat(solution.text()).isEqualTo("""
                {
                    first(
                        alpha,
                        beta
                    )
                    second(gamma)
                }""");
            assertThat(solution.cost()).isEqualTo(1);
        }

        @Test
        void solve_breaksTiesByLowestStateValues() {
            var chain = chain();

            chain.finalizeTree();
            var solution = Solver.solve(chain, 20);

            // Splitting after the properties and splitting fully both fit at the same cost.
            assertThat(solution.stateOf(chain)).isNotEqualTo(State.FULL_SPLIT);
            assertThat(solution.stateOf(chain).value()).isEqualTo(2);
        }

        @Test
        void solve_prefersLeastOverflow_whenNothingFits() {
            var root = call("aVeryLongFunctionName", "argument");

            root.finalizeTree();
            var solution = Solver.solve(root, 10);

            assertThat(solution.fits()).isFalse();
            assertThat(solution.text()).isEqualTo("""
                aVeryLongFunctionName(
                    argument
                )""");
            assertThat(solution.overflow()).isEqualTo(14);
        }

        @Test
        void solve_keepsPinnedStates() {
            var arguments = fragments.arguments(fragments.text("a"));
            var root = fragments.adjacent(fragments.text("f"), arguments);

            arguments.pin(State.FULL_SPLIT);
            root.finalizeTree();
            var solution = Solver.solve(root, 80);

            assertThat(solution.stateOf(arguments)).isEqualTo(State.FULL_SPLIT);
            assertThat(solution.text()).isEqualTo("f(\n    a\n)");
            assertThat(solution.cost()).isEqualTo(1);
        }

        @Test
        void solve_bindsEagerStatesWithoutPinning() {
            var sum = fragments.infix(List.of(fragments.text("aaaa"), fragments.text("bbbb"), fragments.text("cccc")),
                                      List.of("+", "+"));

            sum.finalizeTree();
            var solution = Solver.solve(sum, 16);

            assertThat(solution.stateOf(sum)).isEqualTo(State.FULL_SPLIT);
            assertThat(solution.text()).isEqualTo("aaaa +\n        bbbb +\n        cccc");
            assertThat(sum.pinnedState()).isEmpty();
        }

        @Test
        void solve_dependsOnlyOnTreeAndWidth_whenSolvedNarrowThenWide() {
            var sum = fragments.infix(List.of(fragments.text("aaaa"), fragments.text("bbbb"), fragments.text("cccc")),
                                      List.of("+", "+"));

            sum.finalizeTree();
            var narrow = Solver.solve(sum, 16);
            var wide = Solver.solve(sum, 80);

            assertThat(narrow.text()).contains("\n");
            assertThat(wide.text()).isEqualTo("aaaa + bbbb + cccc");
            assertThat(wide.cost()).isZero();
            assertThat(Solver.solve(sum, 16).text()).isEqualTo(narrow.text());
        }

        @Test
        void solve_isDeterministic() {
            var first = chain();
            var second = chain();

            first.finalizeTree();
            second.finalizeTree();

            var firstSolution = Solver.solve(first, 20);
            var secondSolution = Solver.solve(second, 20);

            assertThat(firstSolution.text()).isEqualTo(secondSolution.text());
            assertThat(firstSolution.cost()).isEqualTo(secondSolution.cost());
        }

        @Test
        void solve_rejectsTreeThatIsNotFinalized() {
            var root = chain();

            assertThatThrownBy(() -> Solver.solve(root, 80)).isInstanceOf(IllegalStateException.class);
        }

        @Test
        void solve_failsLoudly_whenNoAssignmentIsValid() {
            var list = fragments.arguments(fragments.block(fragments.text("x;")));

            list.preventSplit();
            list.finalizeTree();

            assertThatThrownBy(() -> Solver.solve(list, 80)).isInstanceOf(IllegalStateException.class);
        }

        @Test
        void solve_returnsBestSoFar_whenAttemptsRunOut() {
            var chain = chain();

            chain.finalizeTree();
            var solution = Solver.solver(LayoutConfig.layoutConfig(20).withMaxAttempts(1))
                                 .solve(chain);

            assertThat(solution.isValid()).isTrue();
            assertThat(solution.fits()).isFalse();
            assertThat(solution.text()).doesNotContain("\n");
        }

        @Test
        void solve_indentsEveryLine_withLeadingIndent() {
            var root = fragments.block(fragments.text("x;"));

            root.finalizeTree();
            var solution = Solver.solver(LayoutConfig.layoutConfig(80).withLeadingIndent(2))
                                 .solve(root);

            assertThat(solution.text()).isEqualTo("  {\n      x;\n  }");
        }

        @Test
        void solve_usesConfiguredIndentSize() {
            var root = fragments.block(fragments.text("x;"));

            root.finalizeTree();
            var solution = Solver.solver(LayoutConfig.layoutConfig(80).withIndentSize(2))
                                 .solve(root);

            assertThat(solution.text()).isEqualTo("{\n  x;\n}");
        }
    }

    @Nested
    class Subtrees {

        @Test
        void solveSubtree_reusesSolution_forSameContext() {
            var chain = chain();

            chain.finalizeTree();
            Solver.solver(LayoutConfig.layoutConfig(20), counter)
                  .solve(chain);

            assertThat(counter.countOf("reuse Solution")).isPositive();
            assertThat(counter.countOf("create Solution")).isPositive();
        }

        @Test
        void solve_givesSameResult_whenSubtreesComeFromCache() {
            var root = fragments.block(call("first", "alpha", "beta"), chain());

            root.finalizeTree();
            var solver = Solver.solver(LayoutConfig.layoutConfig(20), counter);
            var first = solver.solve(root);
            var created = counter.countOf("create Solution");
            var second = solver.solve(root);

            assertThat(second.text()).isEqualTo(first.text());
            assertThat(second.cost()).isEqualTo(first.cost());
            assertThat(counter.countOf("create Solution") - created).isEqualTo(1);
        }
    }

    @Nested
    class Binding {

        @Test
        void tryBind_rejectsUnsplitChain_whenCallHasHardNewline() {
            var chain = fragments.chain(fragments.text("target"))
                                 .call(fragments.text(".run() // note\n"), CallKind.UNSPLITTABLE_CALL)
                                 .call(fragments.text(".end()"), CallKind.UNSPLITTABLE_CALL)
                                 .build();
            chain.finalizeTree();

            assertThat(Solution.tryBind(new HashMap<>(), chain, State.UNSPLIT)).isFalse();
            assertThat(Solution.tryBind(new HashMap<>(), chain, State.FULL_SPLIT)).isTrue();
        }

        @Test
        void tryBind_rejectsConflictingState() {
            var list = fragments.arguments(fragments.text("a"));
            list.finalizeTree();
            var bindings = new HashMap<Fragment, State>();

            assertThat(Solution.tryBind(bindings, list, State.FULL_SPLIT)).isTrue();
            assertThat(Solution.tryBind(bindings, list, State.UNSPLIT)).isFalse();
            assertThat(Solution.tryBind(bindings, list, State.FULL_SPLIT)).isTrue();
        }

        @Test
        void tryBind_bindsConstrainedFragments() {
            var partner = fragments.arguments(fragments.text("a"));
            var linked = new Linked(fragments.text("call"), partner, false);
            var bindings = new HashMap<Fragment, State>();

            linked.finalizeTree();

            assertThat(Solution.tryBind(bindings, linked, State.FULL_SPLIT)).isTrue();
            assertThat(bindings).containsEntry(linked, State.FULL_SPLIT)
                                .containsEntry(partner, State.FULL_SPLIT);
        }

        @Test
        void tryBind_rejectsState_whenConstrainedFragmentIsBoundOtherwise() {
            var partner = fragments.arguments(fragments.text("a"));
            var linked = new Linked(fragments.text("call"), partner, false);
            var bindings = new HashMap<Fragment, State>();

            linked.finalizeTree();
            bindings.put(partner, State.UNSPLIT);

            assertThat(Solution.tryBind(bindings, linked, State.FULL_SPLIT)).isFalse();
            assertThat(Solution.tryBind(new HashMap<>(), linked, State.UNSPLIT)).isTrue();
        }

        @Test
        void solve_splitsConstrainedFragment_whenSearchBindsItsPartner() {
            var partner = fragments.arguments(fragments.text("alpha"), fragments.text("beta"));
            var linked = new Linked(fragments.text("call"), partner, false);

            linked.finalizeTree();
            var solution = Solver.solve(linked, 10);

            assertThat(solution.stateOf(linked)).isEqualTo(State.FULL_SPLIT);
            assertThat(solution.stateOf(partner)).isEqualTo(State.FULL_SPLIT);
            assertThat(solution.cost()).isEqualTo(2);
            assertThat(solution.text()).isEqualTo("call(\n    alpha,\n    beta\n)");
        }

        @Test
        void solve_appliesConstraintsOfEagerState() {
            var partner = fragments.arguments(fragments.text("a"));
            var linked = new Linked(fragments.text("call"), partner, true);

            linked.finalizeTree();
            var solution = Solver.solve(linked, 80);

            assertThat(solution.stateOf(partner)).isEqualTo(State.FULL_SPLIT);
            assertThat(solution.text()).isEqualTo("call(\n    a\n)");
            assertThat(linked.pinnedState()).isEmpty();
            assertThat(partner.pinnedState()).isEmpty();
        }

        @Test
        void tryBind_respectsPinnedState() {
            var list = fragments.arguments(fragments.text("a"));

            list.preventSplit();
            list.finalizeTree();

            assertThat(Solution.tryBind(new HashMap<>(), list, State.FULL_SPLIT)).isFalse();
            assertThat(Solution.tryBind(new HashMap<>(), list, State.UNSPLIT)).isTrue();
        }
    }

    @Test
    void solution_reportsShapeOfRoot() {
        var root = call("f", "alpha", "beta");

        root.finalizeTree();

        assertThat(Solver.solve(root, 80).shape()).isEqualTo(Shape.INLINE);
        assertThat(Solver.solve(root, 10).shape()).isEqualTo(Shape.BLOCK);
    }

    /**
     * Writes a name followed by a partner that must split whenever this fragment splits.
     */
    private static final class Linked extends Fragment {
        private static final List<State> STATES = State.ascending(List.of(State.FULL_SPLIT));

        private final Fragment name;
        private final Fragment partner;
        private final boolean alwaysSplit;

        private Linked(Fragment name, Fragment partner, boolean alwaysSplit) {
            super(FragmentCounter.none());
            this.name = name;
            this.partner = partner;
            this.alwaysSplit = alwaysSplit;
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
        public void applyConstraints(State state, Constrain constrain) {
            if (state.equals(State.FULL_SPLIT)) {
                constrain.constrain(partner, State.FULL_SPLIT);
            }
        }

        @Override
        public Optional<State> eagerState(int pageWidth) {
            return alwaysSplit ? Optional.of(State.FULL_SPLIT) : Optional.empty();
        }

        @Override
        public void render(FragmentWriter writer, State state) {
            writer.render(name);
            writer.render(partner);
        }

        @Override
        public List<Fragment> children() {
            return List.of(name, partner);
        }
    }
}
