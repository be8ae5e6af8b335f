package io.flowdeck.core.validation;

import java.util.Objects;

/// A single violation reported by a validator.
///
/// @param type kind of violation, not null
/// @param path location of the offending element (e.g. `tasks[2].loopOver[0]`, `edges[3]`),
///     not null
/// @param message human-readable explanation, not null
public record ValidationIssue(IssueType type, String path, String message) {

    public ValidationIssue {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return path + ": " + message + " [" + type + "]";
    }
}
