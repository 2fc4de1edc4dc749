package com.shop.graphrecs.graph;

import java.util.List;
import java.util.Map;

/**
 * Write side of one graph store session. Every call is its own auto-committed round trip.
 */
public interface GraphWriter extends AutoCloseable {

    /**
     * Name of the list parameter that batched statements UNWIND
     */
    String ROWS_PARAMETER = "rows";

    /**
     * Execute a statement without parameters (schema setup)
     */
    void run(String statement);

    /**
     * Execute a statement once with the whole batch bound to {@code $rows}
     */
    void runBatch(String statement, List<Map<String, Object>> rows);

    @Override
    void close();
}
