package com.docrender.core.operation;

import java.util.List;
import java.util.Map;

/**
 * Reduces the rows of one group to a single value.
 */
@FunctionalInterface
public interface AggregateFunction {

    /**
     * Computes the aggregate.
     *
     * @param rows rows of one group, never empty when called by {@link GroupByOperation}
     * @return aggregate value
     */
    Object apply(List<Map<String, Object>> rows);
}
