package com.shop.graphrecs.service;

import com.shop.graphrecs.dto.LoadSummary;
import com.shop.graphrecs.entity.SourceSnapshot;
import com.shop.graphrecs.exception.ReadinessTimeoutException;
import com.shop.graphrecs.repository.ShopSourceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.net.ConnectException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EtlPipelineServiceTest {

    @Mock
    private ReadinessGate readinessGate;
    @Mock
    private StoreProbes storeProbes;
    @Mock
    private ShopSourceRepository sourceRepository;
    @Mock
    private SnapshotNormalizer snapshotNormalizer;
    @Mock
    private GraphLoaderService graphLoaderService;

    private EtlPipelineService pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new EtlPipelineService(readinessGate, storeProbes, sourceRepository,
                snapshotNormalizer, graphLoaderService);
    }

    @Test
    void testStagesRunInOrder() {
        SourceSnapshot raw = new SourceSnapshot();
        SourceSnapshot normalized = new SourceSnapshot();
        LoadSummary summary = new LoadSummary();
        when(sourceRepository.extract()).thenReturn(raw);
        when(snapshotNormalizer.normalize(raw)).thenReturn(normalized);
        when(graphLoaderService.load(normalized)).thenReturn(summary);

        assertSame(summary, pipeline.run());

        InOrder order = inOrder(readinessGate, sourceRepository, snapshotNormalizer, graphLoaderService);
        order.verify(readinessGate).awaitReady(eq(StoreProbes.SOURCE), any());
        order.verify(readinessGate).awaitReady(eq(StoreProbes.GRAPH), any());
        order.verify(sourceRepository).extract();
        order.verify(snapshotNormalizer).normalize(raw);
        order.verify(graphLoaderService).load(normalized);
    }

    @Test
    void testReadinessTimeoutStopsBeforeExtraction() {
        ReadinessTimeoutException timeout = new ReadinessTimeoutException(
                StoreProbes.SOURCE, Duration.ofSeconds(120), 120, new ConnectException("refused"));
        doThrow(timeout).when(readinessGate).awaitReady(eq(StoreProbes.SOURCE), any());

        assertSame(timeout, assertThrows(ReadinessTimeoutException.class, () -> pipeline.run()));

        verifyNoInteractions(sourceRepository, snapshotNormalizer, graphLoaderService);
    }

    @Test
    void testExtractionFailurePropagatesUnchanged() {
        DataAccessResourceFailureException failure = new DataAccessResourceFailureException("relation does not exist");
        when(sourceRepository.extract()).thenThrow(failure);

        assertSame(failure, assertThrows(DataAccessResourceFailureException.class, () -> pipeline.run()));

        verifyNoInteractions(snapshotNormalizer, graphLoaderService);
    }
}
