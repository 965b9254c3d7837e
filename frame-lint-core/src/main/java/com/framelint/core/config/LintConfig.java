package com.framelint.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration for Frame Lint runs.
 *
 * <p>Loaded from {@code framelint.yaml}. Defines project metadata, the active rule set
 * and report output settings.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "Landing page"
 *   id: "landing-2026"
 *
 * rules:
 *   disabled:
 *     - COMPONENT_NOT_USED
 *
 * output:
 *   directory: "./framelint-report"
 *   formats:
 *     - markdown
 *     - json
 * }</pre>
 *
 * @param project project metadata
 * @param rules rule selection
 * @param output report output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LintConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("rules") RulesConfig rules,
    @JsonProperty("output") OutputConfig output
) {
    /** Default report directory. */
    public static final String DEFAULT_OUTPUT_DIRECTORY = "./framelint-report";

    /**
     * Compact constructor filling absent sections with their defaults.
     */
    public LintConfig {
        if (project == null) {
            project = new ProjectInfo("design", "default");
        }
        if (rules == null) {
            rules = RulesConfig.all();
        }
        if (output == null) {
            output = new OutputConfig(DEFAULT_OUTPUT_DIRECTORY, List.of("markdown"));
        }
    }

    /**
     * Creates a default configuration with every rule enabled.
     *
     * @return default configuration
     */
    public static LintConfig defaults() {
        return new LintConfig(null, null, null);
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param id project id stamped on analysis summaries
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("id") String id
    ) {}

    /**
     * Rule selection mode.
     */
    public enum RuleMode {
        /** Every catalogue rule runs, minus the disabled ones */
        ALL,
        /** Only the listed rules run, minus the disabled ones */
        EXPLICIT
    }

    /**
     * Rule selection.
     *
     * @param mode selection mode (null = EXPLICIT if an enabled list is present, ALL otherwise)
     * @param enabled rule ids to run (EXPLICIT mode only)
     * @param disabled rule ids never to run
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RulesConfig(
        @JsonProperty("mode") RuleMode mode,
        @JsonProperty("enabled") List<String> enabled,
        @JsonProperty("disabled") List<String> disabled
    ) {
        public RulesConfig {
            enabled = enabled == null ? List.of() : List.copyOf(enabled);
            disabled = disabled == null ? List.of() : List.copyOf(disabled);
        }

        /**
         * Selection running every rule.
         *
         * @return ALL mode with nothing disabled
         */
        public static RulesConfig all() {
            return new RulesConfig(RuleMode.ALL, List.of(), List.of());
        }

        /**
         * Get the effective rule mode.
         *
         * @return explicit mode if set, otherwise inferred from the enabled list
         */
        public RuleMode effectiveMode() {
            if (mode != null) {
                return mode;
            }
            return enabled.isEmpty() ? RuleMode.ALL : RuleMode.EXPLICIT;
        }

        /**
         * Checks if a rule is enabled.
         *
         * @param ruleId rule id to check
         * @return true if the rule should run
         */
        public boolean isEnabled(String ruleId) {
            if (disabled.contains(ruleId)) {
                return false;
            }
            return switch (effectiveMode()) {
                case ALL -> true;
                case EXPLICIT -> enabled.contains(ruleId);
            };
        }

        /**
         * Every rule id this selection names, enabled or disabled.
         *
         * @return named ids in declaration order
         */
        public List<String> referencedIds() {
            List<String> ids = new ArrayList<>(enabled);
            ids.addAll(disabled);
            return List.copyOf(ids);
        }
    }

    /**
     * Report output configuration.
     *
     * @param directory output directory path
     * @param formats report formats to write (markdown, json)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("formats") List<String> formats
    ) {
        public OutputConfig {
            if (directory == null || directory.isBlank()) {
                directory = DEFAULT_OUTPUT_DIRECTORY;
            }
            formats = formats == null ? List.of() : List.copyOf(formats);
        }
    }
}
