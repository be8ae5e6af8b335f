package io.flowdeck.core.scenario;

import java.util.Locale;

/// Category of a generated test scenario.
public enum TestType {
    HAPPY_PATH,
    EDGE_CASE,
    ERROR_CASE,
    BOUNDARY;

    /// @return snake-case name used on the wire (e.g. `happy_path`)
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// @param wireName snake-case name, case-insensitive, not null
    /// @return matching type
    /// @throws IllegalArgumentException if no type has that name
    public static TestType fromWireName(String wireName) {
        for (TestType type : values()) {
            if (type.wireName().equalsIgnoreCase(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown test type: " + wireName);
    }
}
