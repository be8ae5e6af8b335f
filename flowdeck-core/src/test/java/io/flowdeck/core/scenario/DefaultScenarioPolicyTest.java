package io.flowdeck.core.scenario;

import static org.assertj.core.api.Assertions.assertThat;

import io.flowdeck.core.task.Task;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("DefaultScenarioPolicy")
class DefaultScenarioPolicyTest {

    private final DefaultScenarioPolicy policy = new DefaultScenarioPolicy();

    @Test
    @DisplayName("HTTP tasks get a happy path and two error cases")
    void shouldGenerateHttpScenarios() {
        Task task =
                Task.builder().name("Fetch user").taskReferenceName("fetch").type("HTTP").build();

        List<Scenario> scenarios = policy.scenariosFor(task, 3);

        assertThat(scenarios)
                .extracting(Scenario::testType)
                .containsExactly(TestType.HAPPY_PATH, TestType.ERROR_CASE, TestType.ERROR_CASE);
        assertThat(scenarios)
                .extracting(Scenario::id)
                .containsExactly("task-3-scenario-0", "task-3-scenario-1", "task-3-scenario-2");
        assertThat(scenarios.get(0).name()).isEqualTo("Fetch user - Successful API Response");
        assertThat(scenarios.get(0).description()).contains("HTTP request to Fetch user");
        assertThat(scenarios).allMatch(s -> s.targetNode().equals("fetch"));
    }

    @Test
    @DisplayName("unknown types get a happy path and an error case")
    void shouldGenerateDefaultScenarios() {
        List<Scenario> scenarios = policy.scenariosFor(Task.of("worker", "my_worker"), 0);

        assertThat(scenarios)
                .extracting(Scenario::testType)
                .containsExactly(TestType.HAPPY_PATH, TestType.ERROR_CASE);
        assertThat(scenarios.get(1).name()).isEqualTo("worker - Missing Required Input");
    }

    @ParameterizedTest(name = "{0} -> {1} scenarios ending in {2}")
    @CsvSource({
        "DECISION, 3, ERROR_CASE",
        "fork_join, 3, EDGE_CASE",
        "FORK, 3, EDGE_CASE",
        "MAPPER, 3, ERROR_CASE",
        "WAIT_FOR_SIGNAL, 2, EDGE_CASE",
        "DO_WHILE, 3, BOUNDARY"
    })
    @DisplayName("scenario set follows the task type")
    void shouldFollowTaskType(String type, int count, TestType last) {
        List<Scenario> scenarios = policy.scenariosFor(Task.of("t", type), 0);

        assertThat(scenarios).hasSize(count);
        assertThat(scenarios.get(0).testType()).isEqualTo(TestType.HAPPY_PATH);
        assertThat(scenarios.get(count - 1).testType()).isEqualTo(last);
    }

    @Test
    @DisplayName("visit completes immediately with pending scenarios")
    void shouldCompleteVisitImmediately() throws Exception {
        List<Scenario> scenarios =
                policy.visit(Task.of("a", "LAMBDA"), 1)
                        .toCompletableFuture()
                        .get(1, TimeUnit.SECONDS);

        assertThat(scenarios).hasSize(3).allMatch(s -> s.status() == ScenarioStatus.PENDING);
    }

    @Test
    @DisplayName("target falls back from reference name to name to visit index")
    void shouldResolveTarget() {
        assertThat(DefaultScenarioPolicy.targetOf(Task.of("ref", "X"), 0)).isEqualTo("ref");
        assertThat(DefaultScenarioPolicy.targetOf(Task.builder().name("n").build(), 0))
                .isEqualTo("n");
        assertThat(DefaultScenarioPolicy.targetOf(Task.builder().taskReferenceName(" ").build(), 7))
                .isEqualTo("task_7");
    }
}
