package io.flowdeck.core.scenario;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Scenario")
class ScenarioTest {

    private static Scenario pending() {
        return Scenario.pending("task-0-scenario-0", "a - Ok", "desc", "a", TestType.HAPPY_PATH);
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("walks the full lifecycle to PASSED")
        void shouldReachPassed() {
            // When
            Scenario passed =
                    pending()
                            .withStatus(ScenarioStatus.GENERATING)
                            .withInput("{\"id\":1}")
                            .withStatus(ScenarioStatus.READY)
                            .withStatus(ScenarioStatus.TESTING)
                            .withExecutionResult("{\"status\":\"COMPLETED\"}", true);

            // Then
            assertThat(passed.status()).isEqualTo(ScenarioStatus.PASSED);
            assertThat(passed.inputJson()).isEqualTo("{\"id\":1}");
            assertThat(passed.executionResult()).contains("COMPLETED");
            assertThat(passed.error()).isNull();
            assertThat(passed.status().isTerminal()).isTrue();
        }

        @Test
        @DisplayName("a failed run can be retried")
        void shouldRetryFailedRun() {
            Scenario failed =
                    pending()
                            .withStatus(ScenarioStatus.READY)
                            .withStatus(ScenarioStatus.TESTING)
                            .failed("assertion failed");

            Scenario retrying = failed.withStatus(ScenarioStatus.TESTING);

            assertThat(failed.error()).isEqualTo("assertion failed");
            assertThat(retrying.status()).isEqualTo(ScenarioStatus.TESTING);
        }

        @Test
        @DisplayName("cannot skip straight to testing")
        void shouldRejectIllegalMove() {
            assertThatThrownBy(() -> pending().withStatus(ScenarioStatus.TESTING))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage(
                            "Scenario 'task-0-scenario-0' cannot move from PENDING to TESTING");
        }

        @Test
        @DisplayName("a passed scenario cannot fail")
        void shouldNotFailPassedScenario() {
            Scenario passed =
                    pending()
                            .withStatus(ScenarioStatus.READY)
                            .withStatus(ScenarioStatus.TESTING)
                            .withExecutionResult("ok", true);

            assertThatThrownBy(() -> passed.failed("late"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("PASSED");
        }

        @Test
        @DisplayName("recording a result requires a running test")
        void shouldRequireTestingForResult() {
            assertThatThrownBy(() -> pending().withExecutionResult("x", false))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    @DisplayName("end-to-end scenarios target the whole workflow")
    void shouldDetectEndToEnd() {
        assertThat(pending().isEndToEnd()).isFalse();
        assertThat(ScenarioTraversal.endToEndScenarios(null))
                .allMatch(Scenario::isEndToEnd)
                .first()
                .satisfies(s -> assertThat(s.description()).contains("entire workflow from"));
    }

    @Nested
    @DisplayName("wire names")
    class WireNames {

        @Test
        @DisplayName("test types use snake case")
        void shouldMapTestTypes() {
            assertThat(TestType.EDGE_CASE.wireName()).isEqualTo("edge_case");
            assertThat(TestType.fromWireName("Happy_Path")).isEqualTo(TestType.HAPPY_PATH);
            assertThatThrownBy(() -> TestType.fromWireName("smoke"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("statuses use lower case")
        void shouldMapStatuses() {
            assertThat(ScenarioStatus.GENERATING.wireName()).isEqualTo("generating");
            assertThat(ScenarioStatus.fromWireName("passed")).isEqualTo(ScenarioStatus.PASSED);
        }
    }
}
