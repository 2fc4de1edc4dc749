package com.shop.graphrecs.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Full in-memory copy of the six source relations taken in one extraction.
 * A null list means the relation is not part of this snapshot.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SourceSnapshot {

    private List<Customer> customers;
    private List<Category> categories;
    private List<Product> products;
    private List<Order> orders;
    private List<OrderItem> orderItems;
    private List<Event> events;
}
