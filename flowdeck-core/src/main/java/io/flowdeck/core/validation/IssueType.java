package io.flowdeck.core.validation;

/// Kind of structural contract violation found in a task tree or canvas graph.
public enum IssueType {
    MISSING_REFERENCE_NAME,
    MISSING_TYPE,
    DUPLICATE_REFERENCE_NAME,
    DUPLICATE_NODE_ID,
    UNKNOWN_NODE,
    MISSING_SEQUENCE_NO,
    NON_CONTIGUOUS_SEQUENCE,
    DANGLING_EDGE,
    NON_SEQUENTIAL_EDGE,
    CONFIG_ID_MISMATCH
}
