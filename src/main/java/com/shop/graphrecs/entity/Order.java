package com.shop.graphrecs.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row of the {@code orders} relation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    private Long id;
    private Long customerId;
    private String ts; // canonical UTC timestamp or null once normalized
}
