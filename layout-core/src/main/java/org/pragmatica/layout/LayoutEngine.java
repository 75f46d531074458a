package org.pragmatica.layout;

import org.pragmatica.layout.fragment.Fragment;
import org.pragmatica.layout.fragment.FragmentCounter;
import org.pragmatica.layout.solver.Solver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for laying out a complete fragment tree.
 *
 * Finalizes the tree if needed and runs a fresh {@link Solver} over it.
 */
public final class LayoutEngine {
    private static final Logger log = LoggerFactory.getLogger(LayoutEngine.class);

    private final LayoutConfig config;
    private final FragmentCounter counter;

    private LayoutEngine(LayoutConfig config, FragmentCounter counter) {
        this.config = config;
        this.counter = counter;
    }

    public static LayoutEngine layoutEngine() {
        return layoutEngine(LayoutConfig.defaultConfig());
    }

    public static LayoutEngine layoutEngine(LayoutConfig config) {
        return new LayoutEngine(config, FragmentCounter.none());
    }

    public static LayoutEngine layoutEngine(LayoutConfig config, FragmentCounter counter) {
        return new LayoutEngine(config, counter);
    }

    public LayoutConfig config() {
        return config;
    }

    /**
     * Lay out the tree rooted at {@code root}.
     *
     * @throws LayoutException if {@code root} is a child of another fragment
     */
    public FormattedLayout layout(Fragment root) {
        if (root.hasParent()) {
            throw new LayoutException(root + " is not the root of its tree");
        }

        root.finalizeTree();

        var solution = Solver.solver(config, counter)
                             .solve(root);

        if (!solution.fits()) {
            log.debug("Layout of {} overflows page width {} by {} characters", root, config.pageWidth(), solution.overflow());
        }

        return new FormattedLayout(solution.text(), solution.cost(), solution.overflow(), solution.assignment());
    }
}
