package io.flowdeck.core.task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Structural shape of a {@link Task}: whether it is a plain leaf or a container of nested
/// child task lists.
///
/// Only four shapes exist, so the hierarchy is sealed and traversal code dispatches on the
/// variant with `instanceof` rather than on the free-form task `type` string.
///
/// ### Variants
/// - {@link Leaf} - no children (simple, HTTP, wait, event, terminate, join, ...)
/// - {@link Decision} - named case lists plus a default list (`SWITCH`, `DECISION`)
/// - {@link ForkJoin} - ordered parallel branches (`FORK_JOIN`)
/// - {@link Loop} - a loop body (`DO_WHILE`)
///
/// @implNote All variants are immutable. Child lists are copied on construction and case
/// maps keep their insertion order.
public sealed interface TaskStructure
        permits TaskStructure.Leaf,
                TaskStructure.Decision,
                TaskStructure.ForkJoin,
                TaskStructure.Loop {

    /// Returns the direct children in document (visit) order.
    ///
    /// @return unmodifiable list of child tasks, never null, empty for leaves
    List<Task> children();

    /// Counts every task nested below this structure, at any depth.
    ///
    /// @return number of descendant tasks, zero for leaves
    default int descendantCount() {
        int count = 0;
        for (Task child : children()) {
            count += 1 + child.getStructure().descendantCount();
        }
        return count;
    }

    /// Shared leaf instance.
    Leaf LEAF = new Leaf();

    /// A task without nested children.
    record Leaf() implements TaskStructure {
        @Override
        public List<Task> children() {
            return List.of();
        }
    }

    /// Decision (switch) task: each case label maps to an ordered child sequence, and
    /// `defaultCase` runs when no label matches.
    ///
    /// @param cases case label to child list, in insertion order, not null
    /// @param defaultCase default child list, not null (may be empty)
    record Decision(Map<String, List<Task>> cases, List<Task> defaultCase)
            implements TaskStructure {

        public Decision {
            Objects.requireNonNull(cases, "cases");
            Objects.requireNonNull(defaultCase, "defaultCase");
            Map<String, List<Task>> copy = new LinkedHashMap<>();
            cases.forEach((label, tasks) -> copy.put(label, List.copyOf(tasks)));
            cases = Collections.unmodifiableMap(copy);
            defaultCase = List.copyOf(defaultCase);
        }

        @Override
        public List<Task> children() {
            List<Task> all = new ArrayList<>();
            cases.values().forEach(all::addAll);
            all.addAll(defaultCase);
            return Collections.unmodifiableList(all);
        }
    }

    /// Fork/join task: every branch runs concurrently on the server.
    ///
    /// @param branches ordered branches, each an ordered child list, not null
    record ForkJoin(List<List<Task>> branches) implements TaskStructure {

        public ForkJoin {
            Objects.requireNonNull(branches, "branches");
            List<List<Task>> copy = new ArrayList<>(branches.size());
            for (List<Task> branch : branches) {
                copy.add(List.copyOf(branch));
            }
            branches = Collections.unmodifiableList(copy);
        }

        @Override
        public List<Task> children() {
            List<Task> all = new ArrayList<>();
            branches.forEach(all::addAll);
            return Collections.unmodifiableList(all);
        }
    }

    /// Do-while task.
    ///
    /// @param body ordered loop body, not null
    record Loop(List<Task> body) implements TaskStructure {

        public Loop {
            body = List.copyOf(Objects.requireNonNull(body, "body"));
        }

        @Override
        public List<Task> children() {
            return body;
        }
    }
}
