package com.shop.graphrecs.dto;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one graph load: rows and batches written per upsert step, in execution order.
 */
@Getter
@ToString
public class LoadSummary {

    @Setter
    private int schemaStatements;

    private final Map<String, Integer> rowsByStep = new LinkedHashMap<>();

    private final Map<String, Integer> batchesByStep = new LinkedHashMap<>();

    /**
     * Events whose type has no relationship mapping, counted per type
     */
    private final Map<String, Long> skippedEventTypes = new LinkedHashMap<>();

    public void recordStep(String step, int rows, int batches) {
        rowsByStep.put(step, rows);
        batchesByStep.put(step, batches);
    }

    public long getSkippedEvents() {
        return skippedEventTypes.values().stream().mapToLong(Long::longValue).sum();
    }
}
