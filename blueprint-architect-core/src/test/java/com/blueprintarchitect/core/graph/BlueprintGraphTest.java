package com.blueprintarchitect.core.graph;

import com.blueprintarchitect.core.model.Binding;
import com.blueprintarchitect.core.model.Component;
import com.blueprintarchitect.core.model.ComponentType;
import com.blueprintarchitect.core.model.SystemBlueprint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.blueprintarchitect.core.BlueprintFixtures.bind;
import static com.blueprintarchitect.core.BlueprintFixtures.blueprint;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link BlueprintGraph}.
 */
class BlueprintGraphTest {

    private BlueprintGraph graph;

    @BeforeEach
    void setUp() {
        // src -> t1 -> t2 -> db, src -> filter, with a duplicate src -> t1 binding on another port
        SystemBlueprint blueprint = blueprint(
            List.of(
                Component.of("src", ComponentType.SOURCE),
                Component.of("t1", ComponentType.TRANSFORMER),
                Component.of("t2", ComponentType.TRANSFORMER),
                Component.of("filter", ComponentType.FILTER),
                Component.of("db", ComponentType.STORE)
            ),
            List.of(
                bind("src", "t1"),
                Binding.of("src", "audit", "t1", "side"),
                bind("t1", "t2"),
                bind("t2", "db"),
                bind("src", "filter"),
                bind("src", "ghost")
            ));
        graph = BlueprintGraph.of(blueprint);
    }

    @Test
    void of_mergesParallelBindingsIntoOneEdge() {
        assertThat(graph.nodeCount()).isEqualTo(5);
        assertThat(graph.edgeCount()).isEqualTo(4);
        assertThat(graph.edge("src", "t1")).hasValueSatisfying(edge ->
            assertThat(edge.ports()).hasSize(2));
    }

    @Test
    void of_skipsUnknownTargets() {
        assertThat(graph.contains("ghost")).isFalse();
        assertThat(graph.successors("src")).containsExactly("t1", "filter");
    }

    @Test
    void degrees_countDistinctNeighbours() {
        assertThat(graph.outDegree("src")).isEqualTo(2);
        assertThat(graph.inDegree("t1")).isEqualTo(1);
        assertThat(graph.inDegree("src")).isZero();
        assertThat(graph.predecessors("db")).containsExactly("t2");
    }

    @Test
    void shortestPathToAny_returnsShortestRoute() {
        assertThat(graph.shortestPathToAny("src", Set.of("db")))
            .contains(List.of("src", "t1", "t2", "db"));
    }

    @Test
    void shortestPathToAny_longChain_reachesEnd() {
        List<Component> components = new ArrayList<>();
        List<Binding> bindings = new ArrayList<>();
        components.add(Component.of("step0", ComponentType.TRANSFORMER));
        for (int i = 1; i <= 25; i++) {
            components.add(Component.of("step" + i, ComponentType.TRANSFORMER));
            bindings.add(bind("step" + (i - 1), "step" + i));
        }
        BlueprintGraph chain = BlueprintGraph.of(blueprint(components, bindings));

        assertThat(chain.shortestPathToAny("step0", Set.of("step25"))).hasValueSatisfying(path ->
            assertThat(path).hasSize(26).startsWith("step0").endsWith("step25"));
        assertThat(chain.shortestPathToAny("step25", Set.of("step0"))).isEmpty();
    }

    @Test
    void shortestPathToAny_startIsTarget_returnsSingleNodePath() {
        assertThat(graph.shortestPathToAny("db", Set.of("db"))).contains(List.of("db"));
    }

    @Test
    void hasPath_followsDirection() {
        assertThat(graph.hasPath("src", "db")).isTrue();
        assertThat(graph.hasPath("db", "src")).isFalse();
        assertThat(graph.reachableFrom("t1")).containsExactly("t2", "db");
    }
}
