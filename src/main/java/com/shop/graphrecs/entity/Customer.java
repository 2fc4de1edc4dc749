package com.shop.graphrecs.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row of the {@code customers} relation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Customer {

    private Long id;
    private String name;

    /**
     * Raw text as extracted; canonical yyyy-MM-dd or null once normalized
     */
    private String joinDate;
}
