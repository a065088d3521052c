package com.docrender.core.pipeline;

import java.time.Duration;
import java.util.List;

/**
 * Summary of one {@link DocumentPipeline#execute} run, stored in the result document metadata
 * under {@link DocumentPipeline#STATS_METADATA_KEY}.
 *
 * @param inputRows rows across all tables before execution
 * @param outputRows rows across all tables after execution
 * @param filteredRows rows removed
 * @param duration total execution time
 * @param operations per-operation statistics in execution order
 */
public record TransformStats(
    int inputRows,
    int outputRows,
    int filteredRows,
    Duration duration,
    List<OperationStat> operations
) {
    /**
     * Compact constructor with validation.
     */
    public TransformStats {
        operations = operations == null ? List.of() : List.copyOf(operations);
    }
}
