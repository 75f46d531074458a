package org.pragmatica.layout.fragment;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FragmentCounterTest {

    @Test
    void counting_recordsCreationPerKind() {
        var counter = FragmentCounter.counting();
        var fragments = Fragments.fragments(counter);

        fragments.adjacent(fragments.text("call"), fragments.arguments(fragments.text("a"), fragments.text("b")));

        assertThat(counter.countOf("create Text")).isEqualTo(3);
        assertThat(counter.countOf("create List")).isEqualTo(1);
        assertThat(counter.countOf("create Adjacent")).isEqualTo(1);
        assertThat(counter.countOf("create Chain")).isZero();
    }

    @Test
    void counts_areSortedByEventName() {
        var counter = FragmentCounter.counting();

        counter.count("b");
        counter.count("a");
        counter.count("b");

        assertThat(counter.counts()).containsExactly(Map.entry("a", 1), Map.entry("b", 2));
    }

    @Test
    void none_isUsedByDefault() {
        assertThat(Fragments.fragments().counter()).isSameAs(FragmentCounter.none());
    }
}
