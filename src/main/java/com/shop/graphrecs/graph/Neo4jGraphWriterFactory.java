package com.shop.graphrecs.graph;

import lombok.RequiredArgsConstructor;
import org.neo4j.driver.Driver;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class Neo4jGraphWriterFactory implements GraphWriterFactory {

    private final Driver driver;

    @Override
    public GraphWriter open() {
        return new Neo4jGraphWriter(driver.session());
    }
}
