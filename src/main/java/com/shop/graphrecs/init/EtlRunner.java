package com.shop.graphrecs.init;

import com.shop.graphrecs.dto.LoadSummary;
import com.shop.graphrecs.service.EtlPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Runs the pipeline once at startup.
 * Only active in the 'etl' profile; the application exits when it returns.
 */
@Component
@Profile("etl")
@RequiredArgsConstructor
@Slf4j
public class EtlRunner implements CommandLineRunner {

    private final EtlPipelineService etlPipelineService;

    @Override
    public void run(String... args) {
        LoadSummary summary = etlPipelineService.run();
        log.debug("Load summary: {}", summary);
    }
}
