package io.flowdeck.core.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Task")
class TaskTest {

    @Nested
    @DisplayName("structure derivation")
    class StructureDerivation {

        @Test
        @DisplayName("task without structural fields is a leaf")
        void shouldBeLeafWithoutStructuralFields() {
            Task task = Task.of("fetch", "HTTP");

            assertThat(task.getStructure()).isInstanceOf(TaskStructure.Leaf.class);
            assertThat(task.isStructural()).isFalse();
            assertThat(task.descendantCount()).isZero();
        }

        @Test
        @DisplayName("decisionCases alone yields a decision with empty default")
        void shouldDeriveDecisionFromCases() {
            // Given
            Map<String, List<Task>> cases = new LinkedHashMap<>();
            cases.put("A", List.of(Task.of("t1", "SIMPLE")));

            // When
            Task task =
                    Task.builder()
                            .taskReferenceName("route")
                            .type("SWITCH")
                            .decisionCases(cases)
                            .build();

            // Then
            assertThat(task.getStructure()).isInstanceOf(TaskStructure.Decision.class);
            TaskStructure.Decision decision = (TaskStructure.Decision) task.getStructure();
            assertThat(decision.cases()).containsOnlyKeys("A");
            assertThat(decision.defaultCase()).isEmpty();
        }

        @Test
        @DisplayName("variant follows the fields present, not the type")
        void shouldIgnoreTypeWhenDerivingStructure() {
            Task task =
                    Task.builder()
                            .taskReferenceName("odd")
                            .type("HTTP")
                            .loopOver(List.of(Task.of("body", "SIMPLE")))
                            .build();

            assertThat(task.getStructure()).isInstanceOf(TaskStructure.Loop.class);
        }

        @Test
        @DisplayName("mixing fork and loop fields is rejected")
        void shouldRejectMixedStructuralFields() {
            Task.Builder builder =
                    Task.builder()
                            .taskReferenceName("mixed")
                            .type("FORK_JOIN")
                            .forkTasks(List.of(List.of(Task.of("a", "SIMPLE"))))
                            .loopOver(List.of(Task.of("b", "SIMPLE")));

            assertThatThrownBy(builder::build)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("mixes structural fields");
        }

        @Test
        @DisplayName("empty fields of another variant become attributes")
        void shouldDemoteEmptyFieldsOfOtherVariants() {
            // Given
            Task.Builder builder =
                    Task.builder()
                            .taskReferenceName("loop")
                            .type("SIMPLE")
                            .decisionCases(Map.of())
                            .forkTasks(List.of())
                            .loopOver(List.of(Task.of("body", "SIMPLE")));

            // When
            Task task = builder.build();

            // Then
            assertThat(task.getStructure()).isInstanceOf(TaskStructure.Loop.class);
            assertThat(task.getAttributes())
                    .containsEntry(Task.DECISION_CASES, Map.of())
                    .containsEntry(Task.FORK_TASKS, List.of());
        }

        @Test
        @DisplayName("type picks the variant when every structural field is empty")
        void shouldUseTypeWhenAllStructuralFieldsAreEmpty() {
            Task fork =
                    Task.builder()
                            .taskReferenceName("fan")
                            .type("FORK_JOIN")
                            .forkTasks(List.of(List.of()))
                            .loopOver(List.of())
                            .build();
            Task leaf =
                    Task.builder()
                            .taskReferenceName("plain")
                            .type("SIMPLE")
                            .defaultCase(List.of())
                            .loopOver(List.of())
                            .build();

            assertThat(fork.getStructure()).isInstanceOf(TaskStructure.ForkJoin.class);
            assertThat(fork.getAttributes()).containsOnlyKeys(Task.LOOP_OVER);
            assertThat(leaf.isStructural()).isFalse();
            assertThat(leaf.getAttributes()).containsOnlyKeys(Task.DEFAULT_CASE, Task.LOOP_OVER);
            assertThat(leaf.toBuilder().build()).isEqualTo(leaf);
        }

        @Test
        @DisplayName("raw structural attribute stays a leaf")
        void shouldKeepRawStructuralStringAsAttribute() {
            Task task =
                    Task.builder()
                            .taskReferenceName("fork")
                            .type("FORK_JOIN")
                            .attribute(Task.FORK_TASKS, "[[{\"taskReferenceName\":\"a\"}]]")
                            .build();

            assertThat(task.getStructure()).isSameAs(TaskStructure.LEAF);
            assertThat(task.getAttribute(Task.FORK_TASKS)).isInstanceOf(String.class);
        }

        @Test
        @DisplayName("typed and raw copies of the same field are rejected")
        void shouldRejectShadowedField() {
            Task.Builder builder =
                    Task.builder()
                            .taskReferenceName("loop")
                            .loopOver(List.of(Task.of("a", "SIMPLE")))
                            .attribute(Task.LOOP_OVER, "[]");

            assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("nested counting")
    class Counting {

        @Test
        @DisplayName("descendantCount includes grandchildren")
        void shouldCountAllDescendants() {
            Task inner =
                    Task.builder()
                            .taskReferenceName("inner")
                            .type("DO_WHILE")
                            .loopOver(List.of(Task.of("x", "SIMPLE"), Task.of("y", "SIMPLE")))
                            .build();
            Task outer =
                    Task.builder()
                            .taskReferenceName("outer")
                            .type("FORK_JOIN")
                            .forkTasks(List.of(List.of(inner), List.of(Task.of("z", "SIMPLE"))))
                            .build();

            assertThat(outer.descendantCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("fieldCount counts set fields and attributes")
        void shouldCountFields() {
            Task task =
                    Task.builder()
                            .name("n")
                            .taskReferenceName("r")
                            .type("SIMPLE")
                            .attribute("joinOn", List.of("a"))
                            .build();

            assertThat(task.fieldCount()).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("copies")
    class Copies {

        @Test
        @DisplayName("toBuilder reproduces an equal task")
        void shouldRoundTripThroughBuilder() {
            Map<String, List<Task>> cases = new LinkedHashMap<>();
            cases.put("yes", List.of(Task.of("a", "SIMPLE")));
            Task task =
                    Task.builder()
                            .name("decide")
                            .taskReferenceName("decide")
                            .type("SWITCH")
                            .inputParameters(Map.of("value", "${workflow.input.flag}"))
                            .decisionCases(cases)
                            .attribute("evaluatorType", "value-param")
                            .build();

            assertThat(task.toBuilder().build()).isEqualTo(task);
        }

        @Test
        @DisplayName("toBuilder keeps a raw default case next to typed cases")
        void shouldKeepRawDefaultCaseOnCopy() {
            Map<String, List<Task>> cases = new LinkedHashMap<>();
            cases.put("yes", List.of(Task.of("a", "SIMPLE")));
            Task task =
                    Task.builder()
                            .taskReferenceName("decide")
                            .type("SWITCH")
                            .decisionCases(cases)
                            .attribute(Task.DEFAULT_CASE, "not json")
                            .build();

            Task copy = task.toBuilder().build();

            assertThat(copy).isEqualTo(task);
            assertThat(copy.getAttribute(Task.DEFAULT_CASE)).isEqualTo("not json");
        }

        @Test
        @DisplayName("withoutAttribute returns the same instance when absent")
        void shouldReturnSameInstanceWhenAttributeAbsent() {
            Task task = Task.of("a", "SIMPLE");

            assertThat(task.withoutAttribute("sequenceNo")).isSameAs(task);
        }

        @Test
        @DisplayName("attributes keep insertion order")
        void shouldKeepAttributeOrder() {
            Task task =
                    Task.builder()
                            .taskReferenceName("a")
                            .attribute("zeta", 1)
                            .attribute("alpha", 2)
                            .attribute("mid", null)
                            .build();

            assertThat(task.getAttributes().keySet()).containsExactly("zeta", "alpha", "mid");
            assertThat(task.getAttributes()).containsEntry("mid", null);
        }
    }

    @Nested
    @DisplayName("TaskType")
    class Types {

        @Test
        @DisplayName("resolves colors case-insensitively with a default")
        void shouldResolveColors() {
            assertThat(TaskType.colorOf("http")).isEqualTo("#0066cc");
            assertThat(TaskType.colorOf("FORK_JOIN")).isEqualTo("#0ea5e9");
            assertThat(TaskType.colorOf("my_worker")).isEqualTo(TaskType.DEFAULT_COLOR);
            assertThat(TaskType.colorOf(null)).isEqualTo(TaskType.DEFAULT_COLOR);
        }
    }
}
