package io.flowdeck.core.validation;

import java.io.Serial;
import java.util.List;
import java.util.stream.Collectors;

/// Raised when a task tree or canvas graph breaks an invariant that round-tripping relies on,
/// such as duplicate reference names or gaps in the node sequence.
///
/// Carries every issue found, not only the first one.
public class WorkflowValidationException extends RuntimeException {
    @Serial private static final long serialVersionUID = -2871526913504470163L;

    private final transient List<ValidationIssue> issues;

    public WorkflowValidationException(List<ValidationIssue> issues) {
        super(describe(issues));
        this.issues = List.copyOf(issues);
    }

    public WorkflowValidationException(ValidationIssue issue) {
        this(List.of(issue));
    }

    /// @return all reported issues in discovery order, never empty
    public List<ValidationIssue> getIssues() {
        return issues;
    }

    private static String describe(List<ValidationIssue> issues) {
        if (issues.size() == 1) {
            return issues.get(0).toString();
        }
        return issues.size()
                + " validation issues: "
                + issues.stream().map(ValidationIssue::toString).collect(Collectors.joining("; "));
    }
}
