package io.flowdeck.core;

import io.flowdeck.core.graph.GraphEditor;
import io.flowdeck.core.graph.GraphProjector;
import io.flowdeck.core.graph.GraphToTreeReducer;
import io.flowdeck.core.layout.LayoutEngine;
import io.flowdeck.core.payload.ConductorPayloadNormalizer;
import io.flowdeck.core.scenario.ScenarioTraversal;
import io.flowdeck.core.task.spi.StructuralFieldParser;
import io.flowdeck.core.validation.GraphValidator;
import io.flowdeck.core.validation.TaskTreeValidator;
import java.util.Objects;

/// Factory for wiring {@link WorkflowDesigner} instances.
///
/// The core has no JSON library, so string-encoded structural fields can only be decoded when
/// a {@link StructuralFieldParser} is supplied. `flowdeck-serialization` provides one:
///
/// ```java
/// var designer = FlowdeckFactory.createDesigner(
///     FlowdeckConfig.builder().scenarioVisitTimeout(Duration.ofSeconds(30)).build(),
///     new JacksonStructuralFieldParser());
/// ```
///
/// @see FlowdeckConfig
public final class FlowdeckFactory {

    private FlowdeckFactory() {}

    /// Creates a designer with default configuration that leaves string-encoded structural
    /// fields undecoded.
    ///
    /// @return a fully wired designer, never null
    public static WorkflowDesigner createDesigner() {
        return createDesigner(new FlowdeckConfig());
    }

    /// @param config designer options, not null
    /// @return a fully wired designer that leaves string-encoded structural fields undecoded
    public static WorkflowDesigner createDesigner(FlowdeckConfig config) {
        return createDesigner(config, StructuralFieldParser.UNSUPPORTED);
    }

    /// Primary factory method that other overloads delegate to.
    ///
    /// @param config designer options, not null
    /// @param parser decoder for string-encoded structural fields, not null
    /// @return a fully wired designer, never null
    public static WorkflowDesigner createDesigner(
            FlowdeckConfig config, StructuralFieldParser parser) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(parser, "parser");

        GraphProjector projector = new GraphProjector(parser, config.getLayout());
        LayoutEngine layoutEngine = new LayoutEngine(config.getLayout());

        return new WorkflowDesigner(
                config,
                projector,
                new GraphToTreeReducer(),
                layoutEngine,
                new GraphEditor(projector, layoutEngine),
                new ScenarioTraversal(config.getScenarioVisitTimeout()),
                new TaskTreeValidator(),
                new GraphValidator(),
                new ConductorPayloadNormalizer());
    }
}
