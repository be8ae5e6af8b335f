package io.flowdeck.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.flowdeck.core.graph.GraphEdge;
import io.flowdeck.core.graph.GraphEditor;
import io.flowdeck.core.graph.GraphNode;
import io.flowdeck.core.graph.GraphProjector;
import io.flowdeck.core.graph.GraphToTreeReducer;
import io.flowdeck.core.graph.Position;
import io.flowdeck.core.graph.ReconciliationPolicy;
import io.flowdeck.core.graph.WorkflowGraph;
import io.flowdeck.core.layout.LayoutEngine;
import io.flowdeck.core.payload.ConductorPayloadNormalizer;
import io.flowdeck.core.scenario.Scenario;
import io.flowdeck.core.scenario.ScenarioTraversal;
import io.flowdeck.core.task.Task;
import io.flowdeck.core.task.WorkflowDefinition;
import io.flowdeck.core.validation.GraphValidator;
import io.flowdeck.core.validation.TaskTreeValidator;
import io.flowdeck.core.validation.WorkflowValidationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("WorkflowDesigner")
@ExtendWith(MockitoExtension.class)
class WorkflowDesignerTest {

    @Mock private GraphToTreeReducer reducer;
    @Mock private TaskTreeValidator taskTreeValidator;

    private static WorkflowDefinition definition() {
        Map<String, List<Task>> cases = new LinkedHashMap<>();
        cases.put("A", List.of(Task.of("t1", "SIMPLE")));
        Task decision =
                Task.builder()
                        .name("route")
                        .taskReferenceName("route")
                        .type("SWITCH")
                        .decisionCases(cases)
                        .defaultCase(List.of(Task.of("t2", "SIMPLE")))
                        .build();
        return WorkflowDefinition.builder()
                .name("orders")
                .version(3)
                .attribute("ownerEmail", "team@example.com")
                .tasks(List.of(Task.of("fetch", "HTTP"), decision, Task.of("done", "TERMINATE")))
                .build();
    }

    private static WorkflowDesigner designerWith(
            FlowdeckConfig config, GraphToTreeReducer reducer, TaskTreeValidator validator) {
        GraphProjector projector = new GraphProjector();
        LayoutEngine layoutEngine = new LayoutEngine();
        return new WorkflowDesigner(
                config,
                projector,
                reducer,
                layoutEngine,
                new GraphEditor(projector, layoutEngine),
                new ScenarioTraversal(),
                validator,
                new GraphValidator(),
                new ConductorPayloadNormalizer());
    }

    @Nested
    @DisplayName("open")
    class Open {

        @Test
        @DisplayName("arranges a linear projection on the snake grid")
        void shouldAutoArrangeOnLoad() {
            WorkflowGraph graph = FlowdeckFactory.createDesigner().open(definition());

            assertThat(graph.nodes()).hasSize(3);
            assertThat(graph.nodes().get(0).getPosition()).isEqualTo(new Position(50, 50));
            assertThat(graph.edges())
                    .extracting(GraphEdge::id)
                    .containsExactly("fetch-route", "route-done");
        }

        @Test
        @DisplayName("keeps the linear placement when auto-arrange is off")
        void shouldKeepLinearPlacementWhenDisabled() {
            FlowdeckConfig config = FlowdeckConfig.builder().autoArrangeLinearOnLoad(false).build();

            WorkflowGraph graph = FlowdeckFactory.createDesigner(config).open(definition());

            assertThat(graph.nodes())
                    .extracting(GraphNode::getPosition)
                    .containsExactly(
                            new Position(0, 0), new Position(300, 0), new Position(600, 0));
        }
    }

    @Nested
    @DisplayName("export")
    class Export {

        @Test
        @DisplayName("round-trips a definition through the canvas")
        void shouldRoundTripDefinition() {
            // Given
            WorkflowDesigner designer = FlowdeckFactory.createDesigner();
            WorkflowDefinition definition = definition();

            // When
            WorkflowGraph graph = designer.open(definition);
            WorkflowDefinition exported = designer.export(definition, graph);

            // Then
            assertThat(exported).isEqualTo(definition);
            assertThat(exported.getAttributes()).containsEntry("ownerEmail", "team@example.com");
        }

        @Test
        @DisplayName("carries canvas edits into the exported definition")
        void shouldExportEdits() {
            WorkflowDesigner designer = FlowdeckFactory.createDesigner();
            WorkflowDefinition definition = definition();
            GraphEditor editor = designer.getEditor();

            WorkflowGraph graph = editor.deleteNode(designer.open(definition), "route");
            graph = editor.addTask(graph, Task.of("notify", "HTTP"));
            WorkflowDefinition exported = designer.export(definition, graph);

            assertThat(exported.getTasks())
                    .extracting(Task::getTaskReferenceName)
                    .containsExactly("fetch", "done", "notify");
            assertThat(exported.getVersion()).isEqualTo(3);
        }

        @Test
        @DisplayName("exportPayload drops canvas keys and fills server defaults")
        void shouldExportPayload() {
            // Given
            WorkflowDesigner designer = FlowdeckFactory.createDesigner();
            WorkflowDefinition definition = definition();
            Task dropped =
                    Task.builder()
                            .taskReferenceName("notify")
                            .type("HTTP")
                            .attribute("label", "Notify")
                            .attribute("position", Map.of("x", 10, "y", 20))
                            .build();
            WorkflowGraph graph = designer.getEditor().addTask(designer.open(definition), dropped);

            // When
            WorkflowDefinition payload = designer.exportPayload(definition, graph);

            // Then
            Task notify = payload.getTasks().get(3);
            assertThat(notify.getAttributes()).doesNotContainKeys("label", "position");
            assertThat(notify.getName()).isEqualTo("notify");
            assertThat(notify.getOptional()).isFalse();
            assertThat(payload.getTasks().get(1).getAttribute("expression"))
                    .isEqualTo("${workflow.input}");
            assertThat(payload.getVersion()).isEqualTo(3);
            assertThat(payload.getAttributes())
                    .containsEntry("ownerEmail", "team@example.com")
                    .containsEntry("schemaVersion", 2)
                    .containsEntry("timeoutPolicy", "TIME_OUT_WF");
        }

        @Test
        @DisplayName("rejects an export with duplicate reference names")
        void shouldValidateOnExport() {
            WorkflowDesigner designer = FlowdeckFactory.createDesigner();
            WorkflowDefinition definition = definition();
            GraphNode clash =
                    GraphNode.builder("clash")
                            .sequenceNo(4)
                            .config(Task.of("t1", "SIMPLE"))
                            .build();
            List<GraphNode> nodes = new ArrayList<>(designer.open(definition).nodes());
            nodes.add(clash);

            assertThatThrownBy(
                            () -> designer.export(definition, new WorkflowGraph(nodes, List.of())))
                    .isInstanceOf(WorkflowValidationException.class)
                    .hasMessageContaining("t1");
        }

        @Test
        @DisplayName("skips validation when disabled and passes the policy through")
        void shouldSkipValidationWhenDisabled() {
            // Given
            FlowdeckConfig config = FlowdeckConfig.builder().validateOnExport(false).build();
            WorkflowDesigner designer = designerWith(config, reducer, taskTreeValidator);
            ReconciliationPolicy policy = ReconciliationPolicy.preferLocal();
            List<Task> reduced = List.of(Task.of("fetch", "HTTP"));
            when(reducer.reduce(anyList(), anyList(), eq(policy))).thenReturn(reduced);

            // When
            WorkflowDefinition exported =
                    designer.export(definition(), WorkflowGraph.empty(), policy);

            // Then
            assertThat(exported.getTasks()).isEqualTo(reduced);
            verify(taskTreeValidator, never()).validate(any());
        }
    }

    @Test
    @DisplayName("validate reports graph issues")
    void shouldValidateGraph() {
        WorkflowGraph broken =
                new WorkflowGraph(List.of(GraphNode.builder("a").sequenceNo(2).build()), List.of());

        assertThatThrownBy(() -> FlowdeckFactory.createDesigner().validate(broken))
                .isInstanceOf(WorkflowValidationException.class);
    }

    @Test
    @DisplayName("generateScenarios covers nested tasks and the whole workflow")
    void shouldGenerateScenarios() throws Exception {
        List<Scenario> scenarios =
                FlowdeckFactory.createDesigner()
                        .generateScenarios(definition())
                        .get(5, TimeUnit.SECONDS);

        // fetch(3) + route(2, SWITCH has no dedicated set) + t1(2) + t2(2) + done(2) + e2e(2)
        assertThat(scenarios).hasSize(13);
        assertThat(scenarios.get(scenarios.size() - 1).id())
                .isEqualTo(ScenarioTraversal.E2E_ERROR_RECOVERY_ID);
        assertThat(scenarios)
                .filteredOn(s -> s.targetNode().equals("t2"))
                .extracting(Scenario::id)
                .containsExactly("task-3-scenario-0", "task-3-scenario-1");
    }
}
