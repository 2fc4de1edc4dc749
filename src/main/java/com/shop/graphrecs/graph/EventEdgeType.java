package com.shop.graphrecs.graph;

import java.util.Arrays;
import java.util.Optional;

/**
 * Relationship types for behavioral events, keyed by the source {@code event_type} value.
 */
public enum EventEdgeType {

    VIEWED("view"),
    CLICKED("click"),
    ADDED_TO_CART("add_to_cart");

    private final String eventType;

    EventEdgeType(String eventType) {
        this.eventType = eventType;
    }

    public String getEventType() {
        return eventType;
    }

    /**
     * Exact, case-sensitive match on the source value
     */
    public static Optional<EventEdgeType> fromEventType(String eventType) {
        return Arrays.stream(values())
                .filter(type -> type.eventType.equals(eventType))
                .findFirst();
    }
}
