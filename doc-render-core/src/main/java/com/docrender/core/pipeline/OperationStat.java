package com.docrender.core.pipeline;

import java.time.Duration;

/**
 * Statistics of one operation applied to one table.
 *
 * @param contentId table id
 * @param operation operation name
 * @param inputRows rows before the operation
 * @param outputRows rows after the operation
 * @param duration time spent
 */
public record OperationStat(String contentId, String operation, int inputRows, int outputRows, Duration duration) {
}
