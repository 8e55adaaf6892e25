package io.graphsight.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.graphsight.core.engine.TraversalState.FrontierEntry;
import io.graphsight.core.graph.Fingerprint;
import io.graphsight.core.graph.Focus;
import io.graphsight.core.graph.NodeIdentity;
import io.graphsight.core.graph.NodeKey;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FrontierOrderTest {

    private static FrontierEntry entry(String label) {
        return new FrontierEntry(Focus.of(label), new NodeIdentity(NodeKey.of(label), Fingerprint.empty()));
    }

    private static Deque<FrontierEntry> pending() {
        Deque<FrontierEntry> frontier = new ArrayDeque<>();
        frontier.addLast(entry("P"));
        return frontier;
    }

    private static List<String> labels(Deque<FrontierEntry> frontier) {
        return frontier.stream().map(e -> e.focus().label()).toList();
    }

    @Nested
    class Enqueue {

        @Test
        void shouldQueueCandidatesBehindPendingFociWhenBreadthFirst() {
            Deque<FrontierEntry> frontier = pending();

            FrontierOrder.BREADTH_FIRST.enqueue(frontier, List.of(entry("X"), entry("Y")));

            assertThat(labels(frontier)).containsExactly("P", "X", "Y");
        }

        @Test
        void shouldPutCandidatesAheadInOracleOrderWhenDepthFirst() {
            Deque<FrontierEntry> frontier = pending();

            FrontierOrder.DEPTH_FIRST.enqueue(frontier, List.of(entry("X"), entry("Y")));

            assertThat(labels(frontier)).containsExactly("X", "Y", "P");
        }
    }

    @Nested
    class FromName {

        @ParameterizedTest
        @CsvSource({
            "bfs, BREADTH_FIRST",
            "breadth-first, BREADTH_FIRST",
            "BREADTH_FIRST, BREADTH_FIRST",
            " DFS , DEPTH_FIRST",
            "depth_first, DEPTH_FIRST"
        })
        void shouldParseKnownNames(String name, FrontierOrder expected) {
            assertThat(FrontierOrder.fromName(name)).isEqualTo(expected);
        }

        @Test
        void shouldRejectUnknownName() {
            assertThatThrownBy(() -> FrontierOrder.fromName("random"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("random");
        }
    }
}
