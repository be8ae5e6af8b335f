package io.flowdeck.core;

import io.flowdeck.core.graph.GraphEditor;
import io.flowdeck.core.graph.GraphProjector;
import io.flowdeck.core.graph.GraphToTreeReducer;
import io.flowdeck.core.graph.ReconciliationPolicy;
import io.flowdeck.core.graph.WorkflowGraph;
import io.flowdeck.core.layout.LayoutEngine;
import io.flowdeck.core.payload.ConductorPayloadNormalizer;
import io.flowdeck.core.scenario.DefaultScenarioPolicy;
import io.flowdeck.core.scenario.ProgressListener;
import io.flowdeck.core.scenario.Scenario;
import io.flowdeck.core.scenario.ScenarioTraversal;
import io.flowdeck.core.scenario.TaskVisitor;
import io.flowdeck.core.task.Task;
import io.flowdeck.core.task.WorkflowDefinition;
import io.flowdeck.core.validation.GraphValidator;
import io.flowdeck.core.validation.TaskTreeValidator;
import io.flowdeck.core.validation.WorkflowValidationException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/// Entry point for turning workflow definitions into canvas graphs and back.
///
/// ### Round trip
/// ```
/// definition --open--> graph --(GraphEditor)--> graph --export--> definition
/// ```
///
/// {@link #open} projects the definition and, when the projection is still in its single-row
/// placement, arranges it on the snake grid. {@link #export} reduces an edited graph back into
/// the definition's task list, reconciling each node with the task it was loaded from.
/// {@link #exportPayload} goes one step further and fills the fields a Conductor server
/// requires, dropping canvas keys.
///
/// Created through {@link FlowdeckFactory}. All collaborators are stateless, so one designer
/// can serve any number of workflows and threads.
public class WorkflowDesigner {

    private static final Logger logger = Logger.getLogger(WorkflowDesigner.class.getName());

    private final FlowdeckConfig config;
    private final GraphProjector projector;
    private final GraphToTreeReducer reducer;
    private final LayoutEngine layoutEngine;
    private final GraphEditor editor;
    private final ScenarioTraversal traversal;
    private final TaskTreeValidator taskTreeValidator;
    private final GraphValidator graphValidator;
    private final ConductorPayloadNormalizer payloadNormalizer;

    WorkflowDesigner(
            FlowdeckConfig config,
            GraphProjector projector,
            GraphToTreeReducer reducer,
            LayoutEngine layoutEngine,
            GraphEditor editor,
            ScenarioTraversal traversal,
            TaskTreeValidator taskTreeValidator,
            GraphValidator graphValidator,
            ConductorPayloadNormalizer payloadNormalizer) {
        this.config = config;
        this.projector = projector;
        this.reducer = reducer;
        this.layoutEngine = layoutEngine;
        this.editor = editor;
        this.traversal = traversal;
        this.taskTreeValidator = taskTreeValidator;
        this.graphValidator = graphValidator;
        this.payloadNormalizer = payloadNormalizer;
    }

    /// Loads a definition onto the canvas.
    ///
    /// @param definition the definition, not null
    /// @return projected graph, snake-arranged if auto-arrange is enabled and the projection is
    ///     linear
    public WorkflowGraph open(WorkflowDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        WorkflowGraph graph = projector.project(definition.getTasks());
        if (config.isAutoArrangeLinearOnLoad() && layoutEngine.isLinearLayout(graph.nodes())) {
            logger.fine("Auto-arranging linear projection of '" + definition.getName() + "'");
            graph = layoutEngine.arrange(graph.nodes());
        }
        logger.info(
                "Opened workflow '"
                        + definition.getName()
                        + "' with "
                        + graph.nodes().size()
                        + " nodes");
        return graph;
    }

    /// Re-lays out a graph on the snake grid, regenerating its edges.
    ///
    /// @param graph the graph, not null
    /// @return arranged graph
    public WorkflowGraph autoArrange(WorkflowGraph graph) {
        Objects.requireNonNull(graph, "graph");
        return layoutEngine.arrange(graph.nodes());
    }

    /// Exports with {@link ReconciliationPolicy#preferRicherStructure()}.
    ///
    /// @see #export(WorkflowDefinition, WorkflowGraph, ReconciliationPolicy)
    public WorkflowDefinition export(WorkflowDefinition definition, WorkflowGraph graph) {
        return export(definition, graph, ReconciliationPolicy.preferRicherStructure());
    }

    /// Writes an edited graph back into a definition.
    ///
    /// @param definition the definition the graph was opened from, not null
    /// @param graph the edited graph, not null
    /// @param policy chooses between node configs and the definition's tasks, not null
    /// @return copy of `definition` with the reduced task list, other fields untouched
    /// @throws WorkflowValidationException if export validation is enabled and the reduced
    ///     tasks break an invariant
    public WorkflowDefinition export(
            WorkflowDefinition definition, WorkflowGraph graph, ReconciliationPolicy policy) {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(graph, "graph");

        List<Task> tasks = reducer.reduce(graph.nodes(), definition.getTasks(), policy);
        if (config.isValidateOnExport()) {
            taskTreeValidator.validate(tasks);
        }
        logger.info(
                "Exported workflow '" + definition.getName() + "' with " + tasks.size() + " tasks");
        return definition.withTasks(tasks);
    }

    /// Exports with {@link ReconciliationPolicy#preferRicherStructure()} and prepares the result
    /// for submission.
    ///
    /// @see #exportPayload(WorkflowDefinition, WorkflowGraph, ReconciliationPolicy)
    public WorkflowDefinition exportPayload(WorkflowDefinition definition, WorkflowGraph graph) {
        return exportPayload(definition, graph, ReconciliationPolicy.preferRicherStructure());
    }

    /// Writes an edited graph back into a definition ready to be sent to a Conductor server.
    ///
    /// @param definition the definition the graph was opened from, not null
    /// @param graph the edited graph, not null
    /// @param policy chooses between node configs and the definition's tasks, not null
    /// @return exported definition with canvas keys removed and required fields filled
    /// @throws WorkflowValidationException if the reduced tasks break an invariant, or a task
    ///     has no type
    public WorkflowDefinition exportPayload(
            WorkflowDefinition definition, WorkflowGraph graph, ReconciliationPolicy policy) {
        return payloadNormalizer.normalize(export(definition, graph, policy));
    }

    /// Checks a graph against the canvas invariants.
    ///
    /// @param graph the graph, not null
    /// @throws WorkflowValidationException listing every issue, if any
    public void validate(WorkflowGraph graph) {
        graphValidator.validate(graph);
    }

    /// Generates scenarios with the built-in per-type policy.
    public CompletableFuture<List<Scenario>> generateScenarios(WorkflowDefinition definition) {
        return generateScenarios(definition, new DefaultScenarioPolicy(), ProgressListener.NOOP);
    }

    /// Generates test scenarios for every task of a definition.
    ///
    /// @param definition the definition, not null
    /// @param visitor per-task scenario generator, not null
    /// @param progress progress sink, may be null
    /// @return future with task scenarios in visit order followed by the end-to-end pair
    public CompletableFuture<List<Scenario>> generateScenarios(
            WorkflowDefinition definition, TaskVisitor visitor, ProgressListener progress) {
        Objects.requireNonNull(definition, "definition");
        return traversal.traverse(definition.getName(), definition.getTasks(), visitor, progress);
    }

    /// @return editor sharing this designer's projector and layout settings
    public GraphEditor getEditor() {
        return editor;
    }

    public FlowdeckConfig getConfig() {
        return config;
    }
}
