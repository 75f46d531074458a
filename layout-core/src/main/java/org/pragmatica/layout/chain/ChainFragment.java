package org.pragmatica.layout.chain;

import org.pragmatica.layout.fragment.Fragment;
import org.pragmatica.layout.fragment.FragmentCounter;
import org.pragmatica.layout.fragment.FragmentWriter;
import org.pragmatica.layout.fragment.Indent;
import org.pragmatica.layout.fragment.Shape;
import org.pragmatica.layout.fragment.ShapeMode;
import org.pragmatica.layout.fragment.State;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * A dotted series of property accesses or method calls, like:
 *
 * <pre>
 * target.getter.method().another.method();
 * </pre>
 *
 * This fragment decides where the chain splits before a {@code .} and which argument lists of its calls may contain
 * newlines. A chain can split in four ways.
 *
 * <p>{@link State#UNSPLIT}: the entire chain on one line.
 *
 * <p>{@link #BLOCK_FORMAT_TRAILING_CALL}: no split before any {@code .}, but the last call (or the one before a
 * trailing unsplittable call) is block formatted while every other call stays on one line:
 *
 * <pre>
 * target.property.first(1).block(
 *     argument,
 *     argument
 * );
 * </pre>
 *
 * <p>{@link #SPLIT_AFTER_PROPERTIES}: split before every call except the leading properties, which stay on the line
 * of the target:
 *
 * <pre>
 * motorcycle.wheels.front
 *         .rotate();
 * </pre>
 *
 * <p>{@link State#FULL_SPLIT}: split before every {@code .} and indent the calls:
 *
 * <pre>
 * target
 *         .getter
 *         .method(argument)
 *         .another;
 * </pre>
 */
public final class ChainFragment extends Fragment {
    /**
     * Newlines allowed in the block call only.
     */
    private static final State BLOCK_FORMAT_TRAILING_CALL = State.state(1, 0, "blockFormatTrailingCall");

    /**
     * Leading properties stay with the target, every other call starts a line.
     */
    private static final State SPLIT_AFTER_PROPERTIES = State.state(2, 1, "splitAfterProperties");

    private static final int NO_BLOCK_CALL = -1;

    private final Fragment target;
    private final List<ChainCall> calls;
    private final int leadingProperties;
    private final int blockCallIndex;
    private final Indent indent;
    private final boolean cascade;
    private final ChainStyle style;
    private final boolean allowSplitInTarget;
    private final List<State> states;
    private final List<Fragment> children;

    private ChainFragment(FragmentCounter counter,
                          Fragment target,
                          List<ChainCall> calls,
                          int leadingProperties,
                          int blockCallIndex,
                          Indent indent,
                          boolean cascade,
                          ChainStyle style,
                          boolean allowSplitInTarget) {
        super(counter);

        // A target without calls is never wrapped in a chain.
        if (calls.isEmpty()) {
            throw new IllegalArgumentException("A chain needs at least one call");
        }
        if (leadingProperties < 0 || leadingProperties > calls.size()) {
            throw new IllegalArgumentException("Leading properties " + leadingProperties + " out of range for "
                                               + calls.size() + " calls");
        }
        if (blockCallIndex != NO_BLOCK_CALL
            && (blockCallIndex < 0 || blockCallIndex >= calls.size()
                || calls.get(blockCallIndex).kind() != CallKind.BLOCK_FORMAT_CALL)) {
            throw new IllegalArgumentException("Call " + blockCallIndex + " cannot be block formatted");
        }

        this.target = target;
        this.calls = List.copyOf(calls);
        this.leadingProperties = leadingProperties;
        this.blockCallIndex = blockCallIndex;
        this.indent = indent;
        this.cascade = cascade;
        this.style = style;
        this.allowSplitInTarget = allowSplitInTarget;
        this.states = State.ascending(declaredStates());
        this.children = collectChildren(target, this.calls);
    }

    /**
     * Start building a chain on {@code target}.
     */
    public static Builder builder(FragmentCounter counter, Fragment target) {
        return new Builder(counter, target);
    }

    public Fragment target() {
        return target;
    }

    public List<ChainCall> calls() {
        return calls;
    }

    public int leadingProperties() {
        return leadingProperties;
    }

    public OptionalInt blockCallIndex() {
        return blockCallIndex == NO_BLOCK_CALL ? OptionalInt.empty() : OptionalInt.of(blockCallIndex);
    }

    public boolean isCascade() {
        return cascade;
    }

    public ChainStyle style() {
        return style;
    }

    @Override
    public List<State> legalStates() {
        return states;
    }

    @Override
    public int cost(State state) {
        if (!state.equals(State.FULL_SPLIT)) {
            return super.cost(state);
        }

        // Prefer splitting a cascade over splitting its target.
        if (cascade) {
            return 0;
        }

        // Keep a chain of properties together and let the surrounding context split instead.
        if (style == ChainStyle.CURRENT && leadingProperties == calls.size()) {
            return 2;
        }

        return super.cost(state);
    }

    @Override
    public Set<Shape> childShapeConstraint(State state, Fragment child) {
        if (child == target) {
            return targetShapes(state);
        }
        if (state.equals(State.UNSPLIT)) {
            return Shape.ONLY_INLINE;
        }
        if (state.equals(SPLIT_AFTER_PROPERTIES)) {
            return Shape.anyIf(!isLeadingProperty(child));
        }
        if (state.equals(BLOCK_FORMAT_TRAILING_CALL)) {
            return calls.get(blockCallIndex).fragment() == child ? Shape.ONLY_BLOCK : Shape.ONLY_INLINE;
        }

        return Shape.ALL;
    }

    @Override
    public void render(FragmentWriter writer, State state) {
        if (state.equals(State.UNSPLIT)) {
            renderInline(writer);
        } else if (state.equals(BLOCK_FORMAT_TRAILING_CALL)) {
            // A cascade is a side effect on its target, so it never reads as a block to the surrounding context.
            if (cascade) {
                writer.setShapeMode(ShapeMode.OTHER);
            }
            renderInline(writer);
        } else if (state.equals(SPLIT_AFTER_PROPERTIES)) {
            renderSplit(writer, leadingProperties);
        } else {
            renderSplit(writer, 0);
        }
    }

    @Override
    public List<Fragment> children() {
        return children;
    }

    private static List<Fragment> collectChildren(Fragment target, List<ChainCall> calls) {
        var children = new ArrayList<Fragment>(calls.size() + 1);

        children.add(target);
        calls.forEach(call -> children.add(call.fragment()));
        return List.copyOf(children);
    }

    private List<State> declaredStates() {
        var declared = new ArrayList<State>();

        if (blockCallIndex != NO_BLOCK_CALL) {
            declared.add(BLOCK_FORMAT_TRAILING_CALL);
        }
        if (leadingProperties > 0 && leadingProperties < calls.size()) {
            declared.add(SPLIT_AFTER_PROPERTIES);
        }
        declared.add(State.FULL_SPLIT);
        return declared;
    }

    private Set<Shape> targetShapes(State state) {
        var fullySplit = state.equals(State.FULL_SPLIT);

        if (style == ChainStyle.LEGACY) {
            return Shape.anyIf(allowSplitInTarget || fullySplit);
        }

        return fullySplit ? Shape.ALL : Shape.INLINE_OR_BLOCK;
    }

    private boolean isLeadingProperty(Fragment child) {
        for (int i = 0; i < leadingProperties; i++) {
            if (calls.get(i).fragment() == child) {
                return true;
            }
        }
        return false;
    }

    private void renderInline(FragmentWriter writer) {
        writer.render(target);

        for (var call : calls) {
            writer.render(call.fragment());
        }
    }

    private void renderSplit(FragmentWriter writer, int unsplitCalls) {
        writer.indented(indent, () -> {
            writer.setShapeMode(ShapeMode.BEFORE_HEADLINE);
            writer.render(target);

            for (int i = 0; i < unsplitCalls; i++) {
                writer.render(calls.get(i).fragment());
            }

            writer.setShapeMode(ShapeMode.AFTER_HEADLINE);

            for (int i = unsplitCalls; i < calls.size(); i++) {
                writer.newline();
                // Every call but the last owns its line.
                writer.render(calls.get(i).fragment(), i < calls.size() - 1);
            }
        });
    }

    /**
     * Collects the calls of a chain and works out which of them may stay with the target or be block formatted.
     */
    public static final class Builder {
        private final FragmentCounter counter;
        private final Fragment target;
        private final List<ChainCall> calls = new ArrayList<>();
        private boolean cascade;
        private Indent indent;
        private ChainStyle style = ChainStyle.CURRENT;
        private boolean allowSplitInTarget;

        private Builder(FragmentCounter counter, Fragment target) {
            this.counter = counter;
            this.target = target;
        }

        public Builder property(Fragment property) {
            return call(property, CallKind.PROPERTY);
        }

        public Builder call(Fragment call, CallKind kind) {
            calls.add(ChainCall.chainCall(call, kind));
            return this;
        }

        /**
         * Apply a postfix operation, like a non-null assertion or an index, to the most recent call.
         */
        public Builder wrapLastPostfix(UnaryOperator<Fragment> postfix) {
            if (calls.isEmpty()) {
                throw new IllegalStateException("No call to apply a postfix operation to");
            }

            var last = calls.size() - 1;
            calls.set(last, calls.get(last).wrapPostfix(postfix));
            return this;
        }

        /**
         * Mark the chain as a cascade: operations applied to one receiver without repeating it.
         */
        public Builder cascade() {
            this.cascade = true;
            return this;
        }

        public Builder indent(Indent indent) {
            this.indent = indent;
            return this;
        }

        public Builder style(ChainStyle style) {
            this.style = style;
            return this;
        }

        /**
         * Whether a {@link ChainStyle#LEGACY} chain lets its target contain newlines while not fully split.
         */
        public Builder allowSplitInTarget(boolean allowSplitInTarget) {
            this.allowSplitInTarget = allowSplitInTarget;
            return this;
        }

        public ChainFragment build() {
            var splitIndent = indent != null
                              ? indent
                              : cascade ? Indent.CASCADE : Indent.EXPRESSION;

            return new ChainFragment(counter,
                                     target,
                                     calls,
                                     countLeadingProperties(),
                                     findBlockCall(),
                                     splitIndent,
                                     cascade,
                                     style,
                                     allowSplitInTarget);
        }

        private int countLeadingProperties() {
            var count = 0;

            while (count < calls.size() && calls.get(count).isProperty()) {
                count++;
            }
            return count;
        }

        /**
         * The last call if it can be block formatted, or the one before it if the last call is a property or
         * unsplittable call hanging off a block formatted one.
         */
        private int findBlockCall() {
            if (calls.isEmpty()) {
                return NO_BLOCK_CALL;
            }

            var last = calls.size() - 1;

            if (calls.get(last).kind() == CallKind.BLOCK_FORMAT_CALL) {
                return last;
            }

            var hanging = calls.get(last).kind() == CallKind.PROPERTY
                          || calls.get(last).kind() == CallKind.UNSPLITTABLE_CALL;

            if (hanging && last > 0 && calls.get(last - 1).kind() == CallKind.BLOCK_FORMAT_CALL) {
                return last - 1;
            }

            return NO_BLOCK_CALL;
        }
    }
}
