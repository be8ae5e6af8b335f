package io.flowdeck.core.scenario;

import io.flowdeck.core.task.Task;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/// Built-in scenario policy: a fixed set of scenarios per task type.
///
/// | Type                         | Scenarios                                   |
/// |------------------------------|---------------------------------------------|
/// | `HTTP`                       | happy_path, error_case, error_case          |
/// | `DECISION`                   | happy_path, edge_case, error_case           |
/// | `FORK_JOIN`, `FORK`          | happy_path, error_case, edge_case           |
/// | `LAMBDA`, `MAPPER`           | happy_path, edge_case, error_case           |
/// | `WAIT`, `WAIT_FOR_SIGNAL`    | happy_path, edge_case                       |
/// | `DO_WHILE`                   | happy_path, error_case, boundary            |
/// | anything else                | happy_path, error_case                      |
///
/// Types match case-insensitively. Ids are `task-{visitIndex}-scenario-{ordinal}`, and
/// every scenario starts out {@link ScenarioStatus#PENDING}.
public class DefaultScenarioPolicy implements TaskVisitor {

    @Override
    public CompletionStage<List<Scenario>> visit(Task task, int visitIndex) {
        return CompletableFuture.completedFuture(scenariosFor(task, visitIndex));
    }

    /// Synchronous form of {@link #visit(Task, int)}.
    ///
    /// @param task the task, not null
    /// @param visitIndex 0-based visit position
    /// @return 2 to 3 pending scenarios, never null
    public List<Scenario> scenariosFor(Task task, int visitIndex) {
        TaskSummary summary = TaskSummary.of(task);
        String type = summary.type() == null ? "" : summary.type().toUpperCase(Locale.ROOT);
        String name = summary.displayName(visitIndex);
        Generator g = new Generator(visitIndex, name, summary.target(visitIndex));

        switch (type) {
            case "HTTP" -> {
                g.add(
                        TestType.HAPPY_PATH,
                        "Successful API Response",
                        "Tests successful HTTP request to "
                                + name
                                + ". Validates that the API returns 200 OK with expected response"
                                + " structure.");
                g.add(
                        TestType.ERROR_CASE,
                        "API Timeout",
                        "Tests behavior when the HTTP request times out. Should handle timeout"
                                + " gracefully and trigger retry or error handling.");
                g.add(
                        TestType.ERROR_CASE,
                        "Invalid Response Format",
                        "Tests handling of malformed JSON response from API. Should validate"
                                + " response structure and fail gracefully.");
            }
            case "DECISION" -> {
                g.add(
                        TestType.HAPPY_PATH,
                        "True Branch Execution",
                        "Tests the decision task when condition evaluates to true. Should route to"
                                + " the success/true branch.");
                g.add(
                        TestType.EDGE_CASE,
                        "False Branch Execution",
                        "Tests the decision task when condition evaluates to false. Should route"
                                + " to the alternate/false branch.");
                g.add(
                        TestType.ERROR_CASE,
                        "Null/Missing Decision Parameter",
                        "Tests behavior when the decision parameter is null or missing. Should"
                                + " handle gracefully with default behavior.");
            }
            case "FORK_JOIN", "FORK" -> {
                g.add(
                        TestType.HAPPY_PATH,
                        "All Parallel Tasks Success",
                        "Tests fork/join when all parallel branches complete successfully. Should"
                                + " converge and continue workflow.");
                g.add(
                        TestType.ERROR_CASE,
                        "Partial Branch Failure",
                        "Tests behavior when one or more parallel branches fail. Should handle"
                                + " partial failures according to join strategy.");
                g.add(
                        TestType.EDGE_CASE,
                        "Parallel Task Timeout",
                        "Tests when one parallel branch times out. Should handle timeout and"
                                + " proceed or fail based on configuration.");
            }
            case "LAMBDA", "MAPPER" -> {
                g.add(
                        TestType.HAPPY_PATH,
                        "Valid Data Transformation",
                        "Tests data transformation with valid input. Should successfully"
                                + " map/transform data to expected output format.");
                g.add(
                        TestType.EDGE_CASE,
                        "Empty Input Data",
                        "Tests transformation with empty or null input. Should handle gracefully"
                                + " or return empty result.");
                g.add(
                        TestType.ERROR_CASE,
                        "Invalid Data Structure",
                        "Tests with malformed input data structure. Should validate input and"
                                + " fail with clear error message.");
            }
            case "WAIT", "WAIT_FOR_SIGNAL" -> {
                g.add(
                        TestType.HAPPY_PATH,
                        "Signal Received Before Timeout",
                        "Tests when signal is received within timeout period. Should proceed"
                                + " immediately upon signal.");
                g.add(
                        TestType.EDGE_CASE,
                        "Timeout Expires",
                        "Tests behavior when timeout expires without receiving signal. Should"
                                + " proceed or fail based on configuration.");
            }
            case "DO_WHILE" -> {
                g.add(
                        TestType.HAPPY_PATH,
                        "Loop Completes Successfully",
                        "Tests loop execution with valid condition. Should iterate correct number"
                                + " of times and exit.");
                g.add(
                        TestType.ERROR_CASE,
                        "Loop Condition Never Met",
                        "Tests when loop condition is never satisfied. Should handle infinite loop"
                                + " prevention.");
                g.add(
                        TestType.BOUNDARY,
                        "Maximum Iterations Reached",
                        "Tests boundary condition when max iterations limit is reached. Should"
                                + " exit loop gracefully.");
            }
            default -> {
                g.add(
                        TestType.HAPPY_PATH,
                        "Successful Execution",
                        "Tests normal successful execution of "
                                + name
                                + ". Should complete without errors.");
                g.add(
                        TestType.ERROR_CASE,
                        "Missing Required Input",
                        "Tests behavior when required input parameters are missing. Should fail"
                                + " with validation error.");
            }
        }
        return g.scenarios;
    }

    /// Reference name, else name, else `task_{visitIndex}`.
    static String targetOf(Task task, int visitIndex) {
        return TaskSummary.of(task).target(visitIndex);
    }

    private static final class Generator {
        private final int visitIndex;
        private final String name;
        private final String target;
        private final List<Scenario> scenarios = new ArrayList<>(3);

        Generator(int visitIndex, String name, String target) {
            this.visitIndex = visitIndex;
            this.name = name;
            this.target = target;
        }

        void add(TestType type, String title, String description) {
            scenarios.add(
                    Scenario.pending(
                            "task-" + visitIndex + "-scenario-" + scenarios.size(),
                            name + " - " + title,
                            description,
                            target,
                            type));
        }
    }
}
