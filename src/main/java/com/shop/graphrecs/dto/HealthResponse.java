package com.shop.graphrecs.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {

    /**
     * True when both the source store and the graph store answered
     */
    private boolean ok;
}
