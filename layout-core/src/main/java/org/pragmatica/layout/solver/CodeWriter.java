package org.pragmatica.layout.solver;

import org.pragmatica.layout.fragment.Fragment;
import org.pragmatica.layout.fragment.FragmentWriter;
import org.pragmatica.layout.fragment.Indent;
import org.pragmatica.layout.fragment.Shape;
import org.pragmatica.layout.fragment.ShapeMode;
import org.pragmatica.layout.fragment.State;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Renders a fragment tree in the states of one {@link Solution}, measuring the result as it goes.
 *
 * Besides the text, the writer works out the cost of the solution, how far its lines overflow the page, whether any
 * fragment ends up in a shape its parent forbids, and which unbound fragment is worth expanding next.
 */
final class CodeWriter implements FragmentWriter {
    private final Solver solver;
    private final Solution solution;
    private final int pageWidth;
    private final int indentSize;

    private final StringBuilder text = new StringBuilder();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final List<Fragment> lineCandidates = new ArrayList<>();

    private int column;
    private int lineIndent;
    private boolean atLineStart;
    private int cost;
    private int overflow;
    private boolean valid = true;
    private Shape shape = Shape.INLINE;

    private Fragment firstUnbound;
    private Fragment overflowCandidate;
    private Fragment invalidCandidate;

    /**
     * @param startColumn column of the first character, or {@code -1} to start on a fresh line at {@code indent}
     * @param indent      indentation of every following line
     */
    CodeWriter(Solver solver, Solution solution, int startColumn, int indent) {
        this.solver = solver;
        this.solution = solution;
        this.pageWidth = solver.config().pageWidth();
        this.indentSize = solver.config().indentSize();
        this.indents.push(indent);

        if (startColumn < 0) {
            breakLine(indent);
            text.setLength(0);
        } else {
            column = startColumn;
        }
    }

    /**
     * Render {@code root}, which must take one of {@code allowedShapes}.
     */
    void renderRoot(Fragment root, Set<Shape> allowedShapes) {
        shape = renderInline(root);

        if (!allowedShapes.contains(shape)) {
            invalidate(root.statefulOffspring());
        }

        endLine();
    }

    String text() {
        return text.toString();
    }

    int cost() {
        return cost;
    }

    int overflow() {
        return overflow;
    }

    boolean isValid() {
        return valid;
    }

    Shape shape() {
        return shape;
    }

    /**
     * The fragment whose states should be tried next, or {@code null} if this solution needs no expansion.
     */
    Fragment expandCandidate() {
        if (!valid) {
            return invalidCandidate != null ? invalidCandidate : firstUnbound;
        }
        if (overflow > 0) {
            return overflowCandidate != null ? overflowCandidate : firstUnbound;
        }
        return null;
    }

    @Override
    public void write(String content) {
        var start = 0;

        for (var end = content.indexOf('\n'); end >= 0; end = content.indexOf('\n', start)) {
            append(content.substring(start, end));
            newline();
            start = end + 1;
        }

        append(content.substring(start));
    }

    @Override
    public void newline() {
        endLine();
        breakLine(indents.peek());

        var top = frames.peek();

        if (top != null) {
            top.ownNewline = true;
        }
    }

    @Override
    public void pushIndent(Indent indent) {
        indents.push(indents.peek() + indent.width(indentSize));
    }

    @Override
    public void popIndent() {
        if (indents.size() <= 1) {
            throw new IllegalStateException("Unbalanced popIndent()");
        }
        indents.pop();
    }

    @Override
    public void setShapeMode(ShapeMode mode) {
        var top = frames.peek();

        if (top == null) {
            return;
        }
        if (mode == ShapeMode.AFTER_HEADLINE) {
            top.headlineEnded = true;
        }
        top.mode = mode;
    }

    @Override
    public void render(Fragment child, boolean separate) {
        var parent = frames.peek();
        var allowed = parent == null
                      ? Shape.ALL
                      : parent.fragment.childShapeConstraint(parent.state, child);
        var childShape = separate
                         ? renderSeparate(child, allowed)
                         : renderInline(child);

        if (parent == null) {
            return;
        }

        parent.childShape = parent.childShape.merge(childShape);

        if (!allowed.contains(childShape)) {
            var candidates = new ArrayList<Fragment>();

            candidates.add(parent.fragment);

            if (separate) {
                candidates.add(child);
            } else {
                candidates.addAll(child.statefulOffspring());
            }
            invalidate(candidates);
        }
    }

    private Shape renderInline(Fragment fragment) {
        var state = solution.stateOf(fragment);
        var unbound = fragment.isStateful() && !solution.isBound(fragment);

        if (fragment.isStateful()) {
            cost += fragment.cost(state);
        }
        if (unbound && firstUnbound == null) {
            firstUnbound = fragment;
        }

        var frame = new Frame(fragment, state, unbound);

        frames.push(frame);
        fragment.render(this, state);
        frames.pop();

        return frame.shape();
    }

    /**
     * Render a child that owns its lines by solving it on its own, reusing an earlier result for the same context.
     */
    private Shape renderSeparate(Fragment fragment, Set<Shape> allowed) {
        var startColumn = atLineStart ? lineIndent : column;
        var subtree = solver.solveSubtree(fragment,
                                          startColumn,
                                          indents.peek(),
                                          solution.bindingsWithin(fragment),
                                          allowed);

        solution.mergeSubtree(subtree);
        cost += subtree.cost();

        var frame = new Frame(fragment, subtree.stateOf(fragment), false);
        var lines = subtree.text().split("\n", -1);

        frames.push(frame);
        append(lines[0]);

        for (int i = 1; i < lines.length; i++) {
            endLine();
            breakLine(0);
            append(lines[i]);
        }
        frames.pop();

        if (!subtree.isValid()) {
            invalidate(List.of(fragment));
        }

        return subtree.shape();
    }

    private void append(String segment) {
        if (segment.isEmpty()) {
            return;
        }
        if (atLineStart) {
            text.append(" ".repeat(lineIndent));
            column = lineIndent;
            atLineStart = false;
        }

        text.append(segment);
        column += segment.length();

        // Once the line overflows, the fragments already on it are all that matter for expansion.
        if (column - segment.length() > pageWidth) {
            return;
        }

        for (Iterator<Frame> it = frames.descendingIterator(); it.hasNext(); ) {
            var frame = it.next();

            if (frame.unbound && !lineCandidates.contains(frame.fragment)) {
                lineCandidates.add(frame.fragment);
            }
        }
    }

    private void endLine() {
        var excess = column - pageWidth;

        if (excess > 0) {
            overflow += excess;

            if (overflowCandidate == null && !lineCandidates.isEmpty()) {
                overflowCandidate = lineCandidates.get(0);
            }
        }

        lineCandidates.clear();
    }

    private void breakLine(int indent) {
        text.append('\n');
        column = 0;
        lineIndent = indent;
        atLineStart = true;

        for (var frame : frames) {
            frame.hasNewline = true;

            if (frame.mode == ShapeMode.BEFORE_HEADLINE) {
                frame.newlineInHeadline = true;
            }
        }
    }

    private void invalidate(List<Fragment> candidates) {
        if (!valid) {
            return;
        }

        valid = false;
        invalidCandidate = candidates.stream()
                                     .filter(fragment -> fragment.isStateful() && !solution.isBound(fragment))
                                     .findFirst()
                                     .orElse(null);
    }

    /**
     * Shape bookkeeping for one fragment being rendered.
     */
    private static final class Frame {
        private final Fragment fragment;
        private final State state;
        private final boolean unbound;

        private ShapeMode mode = ShapeMode.MERGE;
        private Shape childShape = Shape.INLINE;
        private boolean hasNewline;
        private boolean ownNewline;
        private boolean headlineEnded;
        private boolean newlineInHeadline;

        private Frame(Fragment fragment, State state, boolean unbound) {
            this.fragment = fragment;
            this.state = state;
            this.unbound = unbound;
        }

        private Shape shape() {
            if (!hasNewline) {
                return Shape.INLINE;
            }
            if (mode == ShapeMode.BLOCK) {
                return Shape.BLOCK;
            }
            if (mode == ShapeMode.OTHER) {
                return Shape.OTHER;
            }
            if (headlineEnded) {
                return newlineInHeadline ? Shape.OTHER : Shape.HEADLINE;
            }
            if (ownNewline) {
                return Shape.OTHER;
            }
            return childShape;
        }
    }
}
