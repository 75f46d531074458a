package org.pragmatica.layout.fragment;

import java.util.List;

/**
 * Children written one right after another with nothing in between.
 */
public final class AdjacentFragment extends Fragment {
    private final List<Fragment> fragments;

    AdjacentFragment(FragmentCounter counter, List<Fragment> fragments) {
        super(counter);
        this.fragments = List.copyOf(fragments);
    }

    @Override
    public void render(FragmentWriter writer, State state) {
        for (var fragment : fragments) {
            writer.render(fragment);
        }
    }

    @Override
    public List<Fragment> children() {
        return fragments;
    }
}
