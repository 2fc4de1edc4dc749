package com.shop.graphrecs.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Uncached reachability checks behind the health endpoint.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StoreHealthService {

    private final StoreProbes storeProbes;

    public boolean isSourceReachable() {
        return reachable(StoreProbes.SOURCE, storeProbes::checkSource);
    }

    public boolean isGraphReachable() {
        return reachable(StoreProbes.GRAPH, storeProbes::checkGraph);
    }

    /**
     * Graph store is only probed when the source store answered
     */
    public boolean isHealthy() {
        return isSourceReachable() && isGraphReachable();
    }

    private boolean reachable(String storeName, StoreProbe probe) {
        try {
            probe.check();
            return true;
        } catch (Exception e) {
            log.debug("{} store unreachable: {}", storeName, e.getMessage());
            return false;
        }
    }
}
