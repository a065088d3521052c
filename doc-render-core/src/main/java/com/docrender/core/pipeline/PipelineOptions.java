package com.docrender.core.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Limits applied by {@link DocumentPipeline}.
 *
 * @param maxOperations maximum number of operations in one pipeline
 * @param maxExecutionTime time budget for {@link DocumentPipeline#execute}
 */
public record PipelineOptions(int maxOperations, Duration maxExecutionTime) {

    public static final int DEFAULT_MAX_OPERATIONS = 100;
    public static final Duration DEFAULT_MAX_EXECUTION_TIME = Duration.ofSeconds(30);

    /**
     * Compact constructor with validation.
     */
    public PipelineOptions {
        if (maxOperations <= 0) {
            throw new IllegalArgumentException("maxOperations must be positive: " + maxOperations);
        }
        Objects.requireNonNull(maxExecutionTime, "maxExecutionTime must not be null");
        if (maxExecutionTime.isNegative() || maxExecutionTime.isZero()) {
            throw new IllegalArgumentException("maxExecutionTime must be positive: " + maxExecutionTime);
        }
    }

    public static PipelineOptions defaults() {
        return new PipelineOptions(DEFAULT_MAX_OPERATIONS, DEFAULT_MAX_EXECUTION_TIME);
    }
}
