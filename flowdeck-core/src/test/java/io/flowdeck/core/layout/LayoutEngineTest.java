package io.flowdeck.core.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowdeck.core.graph.AnchorSide;
import io.flowdeck.core.graph.GraphEdge;
import io.flowdeck.core.graph.GraphNode;
import io.flowdeck.core.graph.Position;
import io.flowdeck.core.graph.WorkflowGraph;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("LayoutEngine")
class LayoutEngineTest {

    private LayoutEngine engine;

    @BeforeEach
    void setUp() {
        engine = new LayoutEngine();
    }

    private static List<GraphNode> nodes(int count) {
        List<GraphNode> nodes = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            nodes.add(GraphNode.builder("n" + i).position(i * 300, 0).sequenceNo(i + 1).build());
        }
        return nodes;
    }

    @Nested
    @DisplayName("positionFor")
    class PositionFor {

        @Test
        @DisplayName("first row runs left to right from the origin")
        void shouldPlaceFirstRowLeftToRight() {
            assertThat(engine.positionFor(0)).isEqualTo(new Position(50, 50));
            assertThat(engine.positionFor(1)).isEqualTo(new Position(250, 50));
            assertThat(engine.positionFor(4)).isEqualTo(new Position(850, 50));
        }

        @Test
        @DisplayName("second row runs right to left")
        void shouldReverseOddRows() {
            assertThat(engine.positionFor(5)).isEqualTo(new Position(850, 170));
            assertThat(engine.positionFor(6)).isEqualTo(new Position(650, 170));
            assertThat(engine.positionFor(9)).isEqualTo(new Position(50, 170));
        }

        @Test
        @DisplayName("third row turns back to left to right")
        void shouldRestoreDirectionOnEvenRows() {
            assertThat(engine.positionFor(10)).isEqualTo(new Position(50, 290));
        }

        @Test
        @DisplayName("honours a custom row width")
        void shouldUseConfiguredRowWidth() {
            LayoutEngine narrow = new LayoutEngine(new LayoutConfig(2, 100, 100, 0, 0, 300));

            assertThat(narrow.positionFor(2)).isEqualTo(new Position(100, 100));
            assertThat(narrow.positionFor(3)).isEqualTo(new Position(0, 100));
        }
    }

    @Nested
    @DisplayName("anchorsFor")
    class AnchorsFor {

        @Test
        @DisplayName("edge inside a row joins right to left")
        void shouldAnchorSameRowEdgesSideways() {
            assertThat(engine.anchorsFor(0)).isEqualTo(EdgeAnchors.SAME_ROW);
            assertThat(engine.anchorsFor(6)).isEqualTo(EdgeAnchors.SAME_ROW);
        }

        @Test
        @DisplayName("edge that turns a row joins bottom to top")
        void shouldAnchorRowTransitionVertically() {
            EdgeAnchors anchors = engine.anchorsFor(4);

            assertThat(anchors.source()).isEqualTo(AnchorSide.BOTTOM);
            assertThat(anchors.target()).isEqualTo(AnchorSide.TOP);
            assertThat(engine.anchorsFor(9)).isEqualTo(EdgeAnchors.ROW_TRANSITION);
        }
    }

    @Nested
    @DisplayName("arrange")
    class Arrange {

        @Test
        @DisplayName("empty input gives an empty graph")
        void shouldHandleEmptyInput() {
            WorkflowGraph graph = engine.arrange(List.of());

            assertThat(graph.nodes()).isEmpty();
            assertThat(graph.edges()).isEmpty();
        }

        @Test
        @DisplayName("seven nodes snake onto two rows with six edges")
        void shouldArrangeSevenNodes() {
            // Given
            List<GraphNode> input = nodes(7);

            // When
            WorkflowGraph graph = engine.arrange(input);

            // Then
            assertThat(graph.nodes())
                    .extracting(GraphNode::getId)
                    .containsExactly("n0", "n1", "n2", "n3", "n4", "n5", "n6");
            assertThat(graph.nodes().get(5).getPosition()).isEqualTo(new Position(850, 170));
            assertThat(graph.edges()).hasSize(6);

            GraphEdge turn = graph.edges().get(4);
            assertThat(turn.id()).isEqualTo("n4-n5");
            assertThat(turn.sourceHandle()).isEqualTo(AnchorSide.BOTTOM);
            assertThat(turn.targetHandle()).isEqualTo(AnchorSide.TOP);

            GraphEdge first = graph.edges().get(0);
            assertThat(first.sourceHandle()).isEqualTo(AnchorSide.RIGHT);
            assertThat(first.targetHandle()).isEqualTo(AnchorSide.LEFT);
            assertThat(first.animated()).isTrue();
        }

        @Test
        @DisplayName("orders by sequence number and renumbers contiguously")
        void shouldSortAndRenumber() {
            List<GraphNode> input =
                    List.of(
                            GraphNode.builder("c").sequenceNo(9).build(),
                            GraphNode.builder("a").sequenceNo(2).build(),
                            GraphNode.builder("b").sequenceNo(5).build());

            WorkflowGraph graph = engine.arrange(input);

            assertThat(graph.nodes()).extracting(GraphNode::getId).containsExactly("a", "b", "c");
            assertThat(graph.nodes())
                    .extracting(GraphNode::getSequenceNo)
                    .containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("nodes without a sequence number sort first")
        void shouldSortMissingSequenceFirst() {
            List<GraphNode> input =
                    List.of(
                            GraphNode.builder("a").sequenceNo(1).build(),
                            GraphNode.builder("loose").build());

            WorkflowGraph graph = engine.arrange(input);

            assertThat(graph.nodes()).extracting(GraphNode::getId).containsExactly("loose", "a");
        }

        @Test
        @DisplayName("is deterministic and leaves the input untouched")
        void shouldBeDeterministicWithoutMutation() {
            List<GraphNode> input = nodes(6);
            List<GraphNode> snapshot = List.copyOf(input);

            WorkflowGraph first = engine.arrange(input);
            WorkflowGraph second = engine.arrange(input);

            assertThat(first).isEqualTo(second);
            assertThat(input).isEqualTo(snapshot);
            assertThat(input.get(1).getPosition()).isEqualTo(new Position(300, 0));
        }

        @Test
        @DisplayName("keeps node configs and labels")
        void shouldPreserveNodeData() {
            GraphNode node = GraphNode.builder("a").label("Alpha").color("#fff").build();

            GraphNode arranged = engine.arrange(List.of(node)).nodes().get(0);

            assertThat(arranged.getLabel()).isEqualTo("Alpha");
            assertThat(arranged.getColor()).isEqualTo("#fff");
        }
    }

    @Nested
    @DisplayName("isLinearLayout")
    class IsLinearLayout {

        @Test
        @DisplayName("detects the projector's single-row placement")
        void shouldDetectLinearPlacement() {
            assertThat(engine.isLinearLayout(nodes(3))).isTrue();
        }

        @Test
        @DisplayName("rejects a snake-arranged graph")
        void shouldRejectArrangedGraph() {
            assertThat(engine.isLinearLayout(engine.arrange(nodes(3)).nodes())).isFalse();
        }

        @Test
        @DisplayName("rejects a single node")
        void shouldRejectSingleNode() {
            assertThat(engine.isLinearLayout(nodes(1))).isFalse();
        }

        @Test
        @DisplayName("rejects a node moved off the row")
        void shouldRejectMovedNode() {
            List<GraphNode> input = new ArrayList<>(nodes(3));
            input.set(2, input.get(2).withPosition(new Position(600, 10)));

            assertThat(engine.isLinearLayout(input)).isFalse();
        }
    }

    @Test
    @DisplayName("LayoutConfig rejects a non-positive row width")
    void shouldRejectInvalidConfig() {
        assertThatThrownBy(() -> new LayoutConfig(0, 200, 120, 50, 50, 300))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nodesPerRow");
    }
}
