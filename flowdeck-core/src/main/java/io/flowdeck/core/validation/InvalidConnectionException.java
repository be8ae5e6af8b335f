package io.flowdeck.core.validation;

import java.io.Serial;

/// Raised when an edge is drawn between nodes that are not sequence neighbours.
public class InvalidConnectionException extends WorkflowValidationException {
    @Serial private static final long serialVersionUID = 6420398813750261937L;

    public InvalidConnectionException(ValidationIssue issue) {
        super(issue);
    }
}
