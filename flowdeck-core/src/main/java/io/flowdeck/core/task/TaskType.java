package io.flowdeck.core.task;

import java.util.Locale;
import java.util.Optional;

/// Task types known to the designer, with their canvas color.
///
/// A task's `type` is free text on the wire; unknown values are legal and are treated as
/// worker tasks. Lookup is case-insensitive.
public enum TaskType {
    SIMPLE("#10b981"),
    HTTP("#0066cc"),
    HUMAN("#f59e0b"),
    INLINE("#8b5cf6"),
    KAFKA_PUBLISH("#ec4899"),
    EVENT("#06b6d4"),
    WAIT("#6366f1"),
    WAIT_FOR_SIGNAL("#6366f1"),
    NOOP("#6b7280"),
    TERMINATE("#dc2626"),
    SWITCH("#f97316"),
    DECISION("#f97316"),
    DO_WHILE("#a855f7"),
    FORK_JOIN("#0ea5e9"),
    FORK("#0ea5e9"),
    FORK_JOIN_DYNAMIC("#0ea5e9"),
    DYNAMIC("#14b8a6"),
    JOIN("#7c3aed"),
    SUB_WORKFLOW("#3b82f6"),
    START_WORKFLOW("#06b6d4"),
    SET_VARIABLE("#10b981"),
    JSON_JQ_TRANSFORM("#10b981"),
    LAMBDA("#10b981"),
    MAPPER("#10b981");

    /// Color used for types outside this enum.
    public static final String DEFAULT_COLOR = "#10b981";

    private final String color;

    TaskType(String color) {
        this.color = color;
    }

    /// Returns the canvas color for this type.
    ///
    /// @return hex color string, never null
    public String getColor() {
        return color;
    }

    /// Resolves a wire type name.
    ///
    /// @param name task type as found in a definition, may be null
    /// @return matching type, or empty for null, blank or unknown names
    public static Optional<TaskType> of(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /// Returns the canvas color for a wire type name, falling back to {@link #DEFAULT_COLOR}.
    ///
    /// @param name task type, may be null
    /// @return hex color string, never null
    public static String colorOf(String name) {
        return of(name).map(TaskType::getColor).orElse(DEFAULT_COLOR);
    }
}
