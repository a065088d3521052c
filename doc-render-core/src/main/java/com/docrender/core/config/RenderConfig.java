package com.docrender.core.config;

import com.docrender.core.pipeline.PipelineOptions;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration for DocRender.
 *
 * <p>Loaded from {@code docrender.yaml}. Durations use ISO-8601 notation ({@code PT30S}).
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * formats:
 *   - markdown
 *   - json
 *
 * output:
 *   directory: "./build/docs"
 *   baseName: "report"
 *   console: false
 *
 * pipeline:
 *   maxOperations: 100
 *   maxExecutionTime: PT30S
 *
 * render:
 *   timeout: PT1M
 * }</pre>
 *
 * @param formats format names to render
 * @param output output configuration
 * @param pipeline pipeline limits
 * @param render render settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RenderConfig(
    @JsonProperty("formats") List<String> formats,
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("pipeline") PipelineConfig pipeline,
    @JsonProperty("render") RenderSettings render
) {
    public static final List<String> DEFAULT_FORMATS = List.of("markdown");

    /**
     * Compact constructor filling in defaults for missing sections.
     */
    public RenderConfig {
        formats = formats == null || formats.isEmpty() ? DEFAULT_FORMATS : List.copyOf(formats);
        output = output == null ? OutputConfig.defaults() : output;
        pipeline = pipeline == null ? PipelineConfig.defaults() : pipeline;
        render = render == null ? RenderSettings.defaults() : render;
    }

    /**
     * Creates the default configuration: markdown to {@code ./docs/report.md}.
     *
     * @return default configuration
     */
    public static RenderConfig defaults() {
        return new RenderConfig(null, null, null, null);
    }

    /**
     * Lists every problem in this configuration.
     *
     * @return problem descriptions, empty when valid
     */
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (output.directory().isBlank()) {
            problems.add("output.directory must not be empty");
        }
        if (output.baseName().isBlank()) {
            problems.add("output.baseName must not be empty");
        }
        if (pipeline.maxOperations() != null && pipeline.maxOperations() <= 0) {
            problems.add("pipeline.maxOperations must be positive");
        }
        checkDuration(problems, "pipeline.maxExecutionTime", pipeline.maxExecutionTime());
        checkDuration(problems, "render.timeout", render.timeout());
        return problems;
    }

    private static void checkDuration(List<String> problems, String field, String value) {
        if (value == null) {
            return;
        }
        try {
            Duration duration = Duration.parse(value);
            if (duration.isNegative() || duration.isZero()) {
                problems.add(field + " must be positive: " + value);
            }
        } catch (DateTimeParseException e) {
            problems.add(field + " is not an ISO-8601 duration: " + value);
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory path
     * @param baseName file name without extension
     * @param console whether to also print output to the console
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("baseName") String baseName,
        @JsonProperty("console") Boolean console
    ) {
        public static final String DEFAULT_DIRECTORY = "./docs";
        public static final String DEFAULT_BASE_NAME = "report";

        public OutputConfig {
            directory = directory == null ? DEFAULT_DIRECTORY : directory;
            baseName = baseName == null ? DEFAULT_BASE_NAME : baseName;
        }

        public static OutputConfig defaults() {
            return new OutputConfig(DEFAULT_DIRECTORY, DEFAULT_BASE_NAME, false);
        }

        public boolean consoleEnabled() {
            return Boolean.TRUE.equals(console);
        }
    }

    /**
     * Pipeline limits.
     *
     * @param maxOperations maximum operations per pipeline
     * @param maxExecutionTime ISO-8601 time budget
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PipelineConfig(
        @JsonProperty("maxOperations") Integer maxOperations,
        @JsonProperty("maxExecutionTime") String maxExecutionTime
    ) {
        public static PipelineConfig defaults() {
            return new PipelineConfig(PipelineOptions.DEFAULT_MAX_OPERATIONS,
                PipelineOptions.DEFAULT_MAX_EXECUTION_TIME.toString());
        }

        /**
         * Converts to pipeline options, using defaults for missing values.
         *
         * @return pipeline options
         */
        public PipelineOptions toOptions() {
            return new PipelineOptions(
                maxOperations == null ? PipelineOptions.DEFAULT_MAX_OPERATIONS : maxOperations,
                maxExecutionTime == null ? PipelineOptions.DEFAULT_MAX_EXECUTION_TIME : Duration.parse(maxExecutionTime));
        }
    }

    /**
     * Render settings.
     *
     * @param timeout ISO-8601 time budget for one render, null for none
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RenderSettings(
        @JsonProperty("timeout") String timeout
    ) {
        public static RenderSettings defaults() {
            return new RenderSettings(null);
        }

        public Duration timeoutDuration() {
            return timeout == null ? null : Duration.parse(timeout);
        }
    }
}
