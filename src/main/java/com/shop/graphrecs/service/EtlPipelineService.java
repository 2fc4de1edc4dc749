package com.shop.graphrecs.service;

import com.shop.graphrecs.dto.LoadSummary;
import com.shop.graphrecs.entity.SourceSnapshot;
import com.shop.graphrecs.repository.ShopSourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the ETL once: wait for both stores, extract, normalize, load.
 * Any stage failure propagates as is.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EtlPipelineService {

    private final ReadinessGate readinessGate;
    private final StoreProbes storeProbes;
    private final ShopSourceRepository sourceRepository;
    private final SnapshotNormalizer snapshotNormalizer;
    private final GraphLoaderService graphLoaderService;

    public LoadSummary run() {
        log.info("=== Waiting for stores ===");
        readinessGate.awaitReady(StoreProbes.SOURCE, storeProbes::checkSource);
        readinessGate.awaitReady(StoreProbes.GRAPH, storeProbes::checkGraph);

        log.info("=== Extracting source snapshot ===");
        SourceSnapshot snapshot = sourceRepository.extract();

        SourceSnapshot normalized = snapshotNormalizer.normalize(snapshot);

        log.info("=== Loading graph ===");
        LoadSummary summary = graphLoaderService.load(normalized);

        log.info("ETL done.");
        return summary;
    }
}
