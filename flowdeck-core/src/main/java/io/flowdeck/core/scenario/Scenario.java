package io.flowdeck.core.scenario;

import java.util.Objects;

/// A generated test scenario for one task, or for the whole workflow.
///
/// Scenarios are immutable; lifecycle moves return a new instance and are checked against
/// {@link ScenarioStatus#canTransitionTo(ScenarioStatus)}.
///
/// @param id stable synthetic id (e.g. `task-3-scenario-1`), not null
/// @param name display name, not null
/// @param description what the scenario exercises, not null
/// @param targetNode reference name of the task under test, or {@link #END_TO_END_TARGET}
/// @param testType scenario category, not null
/// @param inputJson workflow input as JSON text, may be null until generated
/// @param status lifecycle state, not null
/// @param executionResult raw result of the last test run, may be null
/// @param error failure message, may be null
public record Scenario(
        String id,
        String name,
        String description,
        String targetNode,
        TestType testType,
        String inputJson,
        ScenarioStatus status,
        String executionResult,
        String error) {

    /// Target of scenarios that exercise the whole workflow rather than one task.
    public static final String END_TO_END_TARGET = "all";

    public Scenario {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(targetNode, "targetNode");
        Objects.requireNonNull(testType, "testType");
        Objects.requireNonNull(status, "status");
    }

    /// Creates a freshly generated scenario with no input yet.
    public static Scenario pending(
            String id, String name, String description, String targetNode, TestType testType) {
        return new Scenario(
                id,
                name,
                description,
                targetNode,
                testType,
                null,
                ScenarioStatus.PENDING,
                null,
                null);
    }

    /// @return true if this scenario covers the whole workflow
    public boolean isEndToEnd() {
        return END_TO_END_TARGET.equals(targetNode);
    }

    /// Moves the scenario to a new lifecycle state.
    ///
    /// @param next target state, not null
    /// @return copy in the new state
    /// @throws IllegalStateException if the move is not a legal lifecycle step
    public Scenario withStatus(ScenarioStatus next) {
        Objects.requireNonNull(next, "next");
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Scenario '" + id + "' cannot move from " + status + " to " + next);
        }
        return new Scenario(
                id,
                name,
                description,
                targetNode,
                testType,
                inputJson,
                next,
                executionResult,
                error);
    }

    /// @param newInputJson input as JSON text, may be null
    /// @return copy with the given input, status unchanged
    public Scenario withInput(String newInputJson) {
        return new Scenario(
                id,
                name,
                description,
                targetNode,
                testType,
                newInputJson,
                status,
                executionResult,
                error);
    }

    /// Records a finished test run: `PASSED` when `passed`, otherwise `FAILED`.
    ///
    /// @param result raw execution output, may be null
    /// @param passed whether the run met expectations
    /// @return copy with the result recorded
    /// @throws IllegalStateException if the scenario is not `TESTING`
    public Scenario withExecutionResult(String result, boolean passed) {
        Scenario moved = withStatus(passed ? ScenarioStatus.PASSED : ScenarioStatus.FAILED);
        return new Scenario(
                id,
                name,
                description,
                targetNode,
                testType,
                inputJson,
                moved.status,
                result,
                passed ? null : error);
    }

    /// Marks the scenario failed with a message.
    ///
    /// @param message failure message, not null
    /// @return copy in `FAILED` with `error` set
    /// @throws IllegalStateException if the scenario has already passed
    public Scenario failed(String message) {
        Objects.requireNonNull(message, "message");
        if (status != ScenarioStatus.FAILED && !status.canTransitionTo(ScenarioStatus.FAILED)) {
            throw new IllegalStateException("Scenario '" + id + "' has already " + status);
        }
        return new Scenario(
                id,
                name,
                description,
                targetNode,
                testType,
                inputJson,
                ScenarioStatus.FAILED,
                executionResult,
                message);
    }
}
