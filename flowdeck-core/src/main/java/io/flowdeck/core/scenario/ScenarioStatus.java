package io.flowdeck.core.scenario;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/// Lifecycle state of a test scenario.
///
/// ```
/// PENDING -> GENERATING -> READY -> TESTING -> PASSED | FAILED
///                            ^         |                  |
///                            |         +-- re-run <-------+
/// ```
///
/// `READY` and `FAILED` may move back to `TESTING` for a re-run. `PENDING` may skip straight to
/// `READY` when inputs need no generation step, and any non-terminal state may fail.
public enum ScenarioStatus {
    PENDING,
    GENERATING,
    READY,
    TESTING,
    PASSED,
    FAILED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ScenarioStatus fromWireName(String wireName) {
        for (ScenarioStatus status : values()) {
            if (status.wireName().equalsIgnoreCase(wireName)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown scenario status: " + wireName);
    }

    /// @param next candidate next state, not null
    /// @return true if moving from this state to `next` is a legal lifecycle step
    public boolean canTransitionTo(ScenarioStatus next) {
        return successors().contains(next);
    }

    /// @return true for `PASSED`
    public boolean isTerminal() {
        return this == PASSED;
    }

    private Set<ScenarioStatus> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(GENERATING, READY, FAILED);
            case GENERATING -> EnumSet.of(READY, FAILED);
            case READY -> EnumSet.of(TESTING, FAILED);
            case TESTING -> EnumSet.of(PASSED, FAILED);
            case FAILED -> EnumSet.of(TESTING);
            case PASSED -> EnumSet.noneOf(ScenarioStatus.class);
        };
    }
}
