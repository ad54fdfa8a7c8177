package com.blueprintarchitect.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Binding} and {@link SystemBlueprint} invariants.
 */
class BindingTest {

    @Test
    void constructor_mismatchedTargetArrays_throws() {
        assertThatThrownBy(() -> new Binding("a", "output", List.of("b", "c"), List.of("input"), null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("equal length");
    }

    @Test
    void constructor_noTargets_throws() {
        assertThatThrownBy(() -> new Binding("a", "output", List.of(), List.of(), null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void describe_fanOut_listsEveryTarget() {
        Binding binding = new Binding("api", "response", List.of("store", "sink"), List.of("input", "in"), null, null);

        assertThat(binding.describe()).isEqualTo("api.response -> store.input, sink.in");
        assertThat(binding.targets()).extracting(Binding.Target::component).containsExactly("store", "sink");
    }

    @Test
    void hasTransformation_blankLabel_isFalse() {
        Binding binding = new Binding("a", "output", List.of("b"), List.of("input"), " ", null);

        assertThat(binding.hasTransformation()).isFalse();
    }

    @Test
    void systemBlueprint_duplicateComponentNames_throws() {
        assertThatThrownBy(() -> new SystemBlueprint("dup", null, null, null,
            List.of(Component.of("a", ComponentType.SOURCE), Component.of("a", ComponentType.STORE)),
            List.of(), null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unique");
    }

    @Test
    void component_commitmentPoint_durableOrEgress() {
        Component store = Component.of("db", ComponentType.STORE);
        Component api = new Component("api", ComponentType.API_ENDPOINT, null, List.of(),
            List.of(new Port("response", "APIResponseSchema", true, false, true, false, false, null)),
            false, false, null);
        Component transformer = Component.of("t", ComponentType.TRANSFORMER);

        assertThat(store.isCommitmentPoint()).isTrue();
        assertThat(api.isCommitmentPoint()).isTrue();
        assertThat(api.hasBoundarySemantics()).isTrue();
        assertThat(transformer.isCommitmentPoint()).isFalse();
        assertThat(api.statefulness()).isEqualTo(Statefulness.STATELESS);
    }
}
