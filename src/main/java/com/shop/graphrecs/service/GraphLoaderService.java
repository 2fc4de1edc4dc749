package com.shop.graphrecs.service;

import com.shop.graphrecs.config.GraphRecsProperties;
import com.shop.graphrecs.dto.LoadSummary;
import com.shop.graphrecs.entity.Event;
import com.shop.graphrecs.entity.SourceSnapshot;
import com.shop.graphrecs.graph.EventEdgeType;
import com.shop.graphrecs.graph.GraphUpsert;
import com.shop.graphrecs.graph.GraphWriter;
import com.shop.graphrecs.graph.GraphWriterFactory;
import com.shop.graphrecs.graph.SchemaScript;
import com.shop.graphrecs.util.Batches;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Writes a normalized snapshot into the graph store.
 *
 * Step order is fixed so that every relationship finds its endpoints:
 * schema, categories, products, customers, orders, order items, events.
 * Each step sends its rows in batches, one round trip per batch. A failing batch aborts
 * the load; batches written before it stay committed and are overwritten on the next run.
 */
@Service
@Slf4j
public class GraphLoaderService {

    private final GraphWriterFactory graphWriterFactory;
    private final SchemaScript schemaScript;
    private final int batchSize;

    public GraphLoaderService(GraphWriterFactory graphWriterFactory,
                              SchemaScript schemaScript,
                              GraphRecsProperties properties) {
        this.graphWriterFactory = graphWriterFactory;
        this.schemaScript = schemaScript;
        this.batchSize = properties.getLoad().getBatchSize();
        if (batchSize <= 0) {
            throw new IllegalArgumentException("graph-recs.load.batch-size must be positive, got " + batchSize);
        }
    }

    public LoadSummary load(SourceSnapshot snapshot) {
        LoadSummary summary = new LoadSummary();
        try (GraphWriter writer = graphWriterFactory.open()) {
            summary.setSchemaStatements(schemaScript.apply(writer));

            upsert(writer, GraphUpsert.CATEGORIES, snapshot.getCategories(), summary);
            upsert(writer, GraphUpsert.PRODUCTS, snapshot.getProducts(), summary);
            upsert(writer, GraphUpsert.CUSTOMERS, snapshot.getCustomers(), summary);
            upsert(writer, GraphUpsert.ORDERS, snapshot.getOrders(), summary);
            upsert(writer, GraphUpsert.ORDER_ITEMS, snapshot.getOrderItems(), summary);

            Map<EventEdgeType, List<Event>> eventsByType = partitionEvents(snapshot.getEvents(), summary);
            for (EventEdgeType type : EventEdgeType.values()) {
                upsert(writer, GraphUpsert.events(type), eventsByType.get(type), summary);
            }
        }
        log.info("Graph load finished: rows {}, batches {}", summary.getRowsByStep(), summary.getBatchesByStep());
        return summary;
    }

    /**
     * Split events by relationship type; events with an unknown type are counted and dropped
     */
    Map<EventEdgeType, List<Event>> partitionEvents(List<Event> events, LoadSummary summary) {
        Map<EventEdgeType, List<Event>> byType = new EnumMap<>(EventEdgeType.class);
        for (EventEdgeType type : EventEdgeType.values()) {
            byType.put(type, new ArrayList<>());
        }
        if (events == null) {
            return byType;
        }

        for (Event event : events) {
            Optional<EventEdgeType> type = EventEdgeType.fromEventType(event.getEventType());
            if (type.isPresent()) {
                byType.get(type.get()).add(event);
            } else {
                summary.getSkippedEventTypes().merge(String.valueOf(event.getEventType()), 1L, Long::sum);
            }
        }
        if (!summary.getSkippedEventTypes().isEmpty()) {
            log.warn("Skipped {} events with unmapped event_type: {}",
                    summary.getSkippedEvents(), summary.getSkippedEventTypes());
        }
        return byType;
    }

    private <T> void upsert(GraphWriter writer, GraphUpsert<T> upsert, List<T> rows, LoadSummary summary) {
        if (rows == null) {
            log.warn("No {} in snapshot, skipping step", upsert.getName());
            rows = Collections.emptyList();
        }

        int batchIndex = 0;
        for (List<T> batch : Batches.chunk(rows, batchSize)) {
            List<Map<String, Object>> parameters = batch.stream()
                    .map(upsert::toParameters)
                    .collect(Collectors.toList());
            try {
                writer.runBatch(upsert.getStatement(), parameters);
            } catch (RuntimeException e) {
                log.error("Batch {} of {} failed ({} rows); aborting load", batchIndex, upsert.getName(), batch.size(), e);
                throw e;
            }
            batchIndex++;
            log.debug("Wrote batch {} of {} ({} rows)", batchIndex, upsert.getName(), batch.size());
        }
        summary.recordStep(upsert.getName(), rows.size(), batchIndex);
        log.info("Upserted {} {} in {} batch(es)", rows.size(), upsert.getName(), batchIndex);
    }
}
