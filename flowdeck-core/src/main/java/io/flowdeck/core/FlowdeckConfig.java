package io.flowdeck.core;

import io.flowdeck.core.layout.LayoutConfig;
import java.time.Duration;
import java.util.Objects;

/// Configuration options for a {@link WorkflowDesigner}.
///
/// Use the {@link Builder} for fluent configuration or construct directly with setters.
///
/// ### Default Values
/// - `layout`: {@link LayoutConfig#DEFAULTS} (5 per row, 200 x 120 spacing, origin 50/50)
/// - `autoArrangeLinearOnLoad`: `true`
/// - `validateOnExport`: `true`
/// - `scenarioVisitTimeout`: none
///
/// @implNote **Not thread-safe**. Configure before passing to {@link FlowdeckFactory} and do
/// not modify afterwards.
///
/// @see FlowdeckFactory#createDesigner(FlowdeckConfig)
public class FlowdeckConfig {
    private LayoutConfig layout = LayoutConfig.DEFAULTS;
    private boolean autoArrangeLinearOnLoad = true;
    private boolean validateOnExport = true;
    private Duration scenarioVisitTimeout;

    /// Creates a configuration with default values.
    public FlowdeckConfig() {}

    /// @return grid and spacing settings, never null
    public LayoutConfig getLayout() {
        return layout;
    }

    /// @param layout grid and spacing settings, not null
    public void setLayout(LayoutConfig layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    /// Returns whether {@link WorkflowDesigner#open} replaces the initial single-row placement
    /// with the snake grid.
    public boolean isAutoArrangeLinearOnLoad() {
        return autoArrangeLinearOnLoad;
    }

    public void setAutoArrangeLinearOnLoad(boolean autoArrangeLinearOnLoad) {
        this.autoArrangeLinearOnLoad = autoArrangeLinearOnLoad;
    }

    /// Returns whether {@link WorkflowDesigner#export} validates the reduced task tree before
    /// returning it.
    public boolean isValidateOnExport() {
        return validateOnExport;
    }

    public void setValidateOnExport(boolean validateOnExport) {
        this.validateOnExport = validateOnExport;
    }

    /// @return upper bound for a single scenario visit, null for no limit
    public Duration getScenarioVisitTimeout() {
        return scenarioVisitTimeout;
    }

    /// @param scenarioVisitTimeout upper bound for a single scenario visit, null for no limit
    public void setScenarioVisitTimeout(Duration scenarioVisitTimeout) {
        this.scenarioVisitTimeout = scenarioVisitTimeout;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link FlowdeckConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on {@link
    /// #build()}.
    public static class Builder {
        private final FlowdeckConfig config = new FlowdeckConfig();

        public Builder layout(LayoutConfig layout) {
            config.setLayout(layout);
            return this;
        }

        public Builder autoArrangeLinearOnLoad(boolean autoArrangeLinearOnLoad) {
            config.autoArrangeLinearOnLoad = autoArrangeLinearOnLoad;
            return this;
        }

        public Builder validateOnExport(boolean validateOnExport) {
            config.validateOnExport = validateOnExport;
            return this;
        }

        public Builder scenarioVisitTimeout(Duration scenarioVisitTimeout) {
            config.scenarioVisitTimeout = scenarioVisitTimeout;
            return this;
        }

        /// @return the configured instance, never null
        public FlowdeckConfig build() {
            return config;
        }
    }
}
