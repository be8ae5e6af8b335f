package io.flowdeck.core.scenario;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Derives the workflow input for a scenario from a baseline input.
///
/// The baseline is copied and tagged with markers that a test harness (or a mock task worker)
/// can read to steer execution:
///
/// | Test type    | Markers added                                                         |
/// |--------------|-----------------------------------------------------------------------|
/// | happy_path   | `_testScenario`, `_expectedOutcome = "success"`                       |
/// | edge_case    | `_testScenario`, `_expectedOutcome = "alternate_path"`                |
/// | error_case   | `_testScenario`, `_expectedOutcome = "error"`, `_forceError = true`   |
/// | boundary     | `_testScenario`, `_expectedOutcome = "boundary"`, `_simulateTimeout = true` |
///
/// Baseline keys are kept unless a marker replaces them.
public class ScenarioInputSynthesizer {

    public static final String TEST_SCENARIO = "_testScenario";
    public static final String EXPECTED_OUTCOME = "_expectedOutcome";
    public static final String FORCE_ERROR = "_forceError";
    public static final String SIMULATE_TIMEOUT = "_simulateTimeout";

    /// @param scenario the scenario to build input for, not null
    /// @param baseInput baseline workflow input, null for none
    /// @return new unmodifiable input map in baseline order followed by markers
    public Map<String, Object> synthesize(Scenario scenario, Map<String, Object> baseInput) {
        Objects.requireNonNull(scenario, "scenario");
        Map<String, Object> input = new LinkedHashMap<>();
        if (baseInput != null) {
            input.putAll(baseInput);
        }
        input.put(TEST_SCENARIO, scenario.name());

        switch (scenario.testType()) {
            case HAPPY_PATH -> input.put(EXPECTED_OUTCOME, "success");
            case EDGE_CASE -> input.put(EXPECTED_OUTCOME, "alternate_path");
            case ERROR_CASE -> {
                input.put(EXPECTED_OUTCOME, "error");
                input.put(FORCE_ERROR, true);
            }
            case BOUNDARY -> {
                input.put(EXPECTED_OUTCOME, "boundary");
                input.put(SIMULATE_TIMEOUT, true);
            }
        }
        return Collections.unmodifiableMap(input);
    }
}
