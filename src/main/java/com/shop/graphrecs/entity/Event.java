package com.shop.graphrecs.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Behavioral event: view, click or add_to_cart (other values are not loaded).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Event {

    private Long customerId;
    private Long productId;
    private String eventType;
    private String ts;
}
