package io.flowdeck.core.payload;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.flowdeck.core.task.Task;
import io.flowdeck.core.task.TaskStructure;
import io.flowdeck.core.task.WorkflowDefinition;
import io.flowdeck.core.validation.IssueType;
import io.flowdeck.core.validation.ValidationIssue;
import io.flowdeck.core.validation.WorkflowValidationException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ConductorPayloadNormalizer")
class ConductorPayloadNormalizerTest {

    private final ConductorPayloadNormalizer normalizer = new ConductorPayloadNormalizer();

    @Nested
    @DisplayName("tasks")
    class Tasks {

        @Test
        @DisplayName("removes canvas keys at every depth")
        void shouldStripInternalKeysRecursively() {
            // Given
            Task body =
                    Task.builder()
                            .taskReferenceName("body")
                            .type("SIMPLE")
                            .attribute("__typename", "WorkflowTask")
                            .attribute("sequenceNo", 1)
                            .build();
            Task loop =
                    Task.builder()
                            .taskReferenceName("loop")
                            .type("DO_WHILE")
                            .attribute("position", Map.of("x", 0, "y", 0))
                            .attribute("loopCondition", "$.loop['iteration'] < 3")
                            .loopOver(List.of(body))
                            .build();

            // When
            Task normalized = normalizer.normalize(loop);

            // Then
            assertThat(normalized.getAttributes()).doesNotContainKey("position");
            Task normalizedBody = ((TaskStructure.Loop) normalized.getStructure()).body().get(0);
            assertThat(normalizedBody.getAttributes())
                    .doesNotContainKeys("__typename", "sequenceNo")
                    .containsEntry("startDelay", 0);
            assertThat(normalized.getAttribute("loopCondition"))
                    .isEqualTo("$.loop['iteration'] < 3");
        }

        @Test
        @DisplayName("fills the fields every task needs")
        void shouldFillTaskDefaults() {
            Task task = Task.builder().taskReferenceName("a").type("HTTP").build();

            Task normalized = normalizer.normalize(task);

            assertThat(normalized.getName()).isEqualTo("a");
            assertThat(normalized.getOptional()).isFalse();
            assertThat(normalized.getAsyncComplete()).isFalse();
            assertThat(normalized.getInputParameters()).isEmpty();
            assertThat(normalized.getAttribute("startDelay")).isEqualTo(0);
        }

        @Test
        @DisplayName("keeps values that are already set")
        void shouldKeepPresentValues() {
            Task task =
                    Task.builder()
                            .name("Fetch")
                            .taskReferenceName("fetch")
                            .type("HTTP")
                            .optional(true)
                            .inputParameters(Map.of("uri", "http://example.com"))
                            .attribute("startDelay", 5)
                            .build();

            Task normalized = normalizer.normalize(task);

            assertThat(normalized.getName()).isEqualTo("Fetch");
            assertThat(normalized.getOptional()).isTrue();
            assertThat(normalized.getInputParameters())
                    .containsEntry("uri", "http://example.com");
            assertThat(normalized.getAttribute("startDelay")).isEqualTo(5);
        }

        @Test
        @DisplayName("gives operators without children their required fields")
        void shouldFillOperatorFields() {
            Task loop = normalizer.normalize(Task.of("loop", "DO_WHILE"));
            Task fork = normalizer.normalize(Task.of("fork", "FORK_JOIN"));
            Task route = normalizer.normalize(Task.of("route", "SWITCH"));
            Task dynamic = normalizer.normalize(Task.of("dyn", "DYNAMIC"));

            assertThat(loop.getStructure()).isEqualTo(new TaskStructure.Loop(List.of()));
            assertThat(loop.getAttribute("loopCondition")).isEqualTo("True");
            assertThat(fork.getStructure())
                    .isEqualTo(new TaskStructure.ForkJoin(List.of(List.of())));
            assertThat(route.getStructure())
                    .isEqualTo(new TaskStructure.Decision(Map.of(), List.of()));
            assertThat(route.getAttribute("expression")).isEqualTo("${workflow.input}");
            assertThat(dynamic.getAttribute("dynamicTaskNameParam")).isEqualTo("taskName");
        }

        @Test
        @DisplayName("leaves a raw structural field alone")
        void shouldKeepRawStructuralField() {
            // Given
            Task route =
                    Task.builder()
                            .taskReferenceName("route")
                            .type("SWITCH")
                            .decisionCases(Map.of("A", List.of(Task.of("t1", "SIMPLE"))))
                            .attribute(Task.DEFAULT_CASE, null)
                            .build();

            // When
            Task normalized = normalizer.normalize(route);

            // Then
            TaskStructure.Decision decision = (TaskStructure.Decision) normalized.getStructure();
            assertThat(decision.cases().get("A").get(0).getOptional()).isFalse();
            assertThat(normalized.getAttributes()).containsEntry(Task.DEFAULT_CASE, null);
        }

        @Test
        @DisplayName("reports every task without a type")
        void shouldRejectMissingTypes() {
            Task untyped = Task.builder().taskReferenceName("x").build();
            Task fork =
                    Task.builder()
                            .taskReferenceName("fork")
                            .type("FORK_JOIN")
                            .forkTasks(List.of(List.of(untyped)))
                            .build();
            WorkflowDefinition definition =
                    WorkflowDefinition.builder()
                            .name("broken")
                            .tasks(List.of(Task.builder().taskReferenceName("y").build(), fork))
                            .build();

            assertThatThrownBy(() -> normalizer.normalize(definition))
                    .isInstanceOf(WorkflowValidationException.class)
                    .satisfies(e -> assertMissingTypesAt((WorkflowValidationException) e));
        }

        private void assertMissingTypesAt(WorkflowValidationException e) {
            assertThat(e.getIssues())
                    .extracting(ValidationIssue::type, ValidationIssue::path)
                    .containsExactly(
                            tuple(IssueType.MISSING_TYPE, "tasks[0]"),
                            tuple(IssueType.MISSING_TYPE, "tasks[1].forkTasks[0][0]"));
        }
    }

    @Nested
    @DisplayName("definitions")
    class Definitions {

        @Test
        @DisplayName("fills workflow defaults and drops saved canvas keys")
        void shouldFillDefinitionDefaults() {
            // Given
            WorkflowDefinition definition =
                    WorkflowDefinition.builder()
                            .name("orders")
                            .attribute("nodes", List.of())
                            .attribute("edges", List.of())
                            .attribute("timeoutSeconds", 0)
                            .attribute("restartable", null)
                            .tasks(List.of(Task.of("a", "SIMPLE")))
                            .build();

            // When
            WorkflowDefinition normalized = normalizer.normalize(definition);

            // Then
            assertThat(normalized.getVersion()).isEqualTo(1);
            assertThat(normalized.getDescription()).isEmpty();
            assertThat(normalized.getAttributes())
                    .doesNotContainKeys("nodes", "edges")
                    .containsEntry("timeoutSeconds", 0)
                    .containsEntry("restartable", true)
                    .containsEntry("schemaVersion", 2)
                    .containsEntry("timeoutPolicy", "TIME_OUT_WF")
                    .containsEntry("workflowStatusListenerEnabled", false)
                    .containsEntry("inputParameters", List.of())
                    .containsEntry("outputParameters", Map.of());
        }

        @Test
        @DisplayName("normalizing twice changes nothing")
        void shouldBeIdempotent() {
            Task route =
                    Task.builder()
                            .taskReferenceName("route")
                            .type("SWITCH")
                            .decisionCases(Map.of("A", List.of(Task.of("t1", "SIMPLE"))))
                            .build();
            WorkflowDefinition definition =
                    WorkflowDefinition.builder()
                            .name("orders")
                            .tasks(List.of(route, Task.of("loop", "DO_WHILE")))
                            .build();

            WorkflowDefinition once = normalizer.normalize(definition);

            assertThat(normalizer.normalize(once)).isEqualTo(once);
        }
    }
}
