package com.shop.graphrecs.config;

import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Graph store (Neo4j) configuration.
 * Creating the driver does not connect; the first session does.
 */
@Configuration
@Slf4j
public class GraphStoreConfig {

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver(GraphRecsProperties properties) {
        GraphRecsProperties.Graph graph = properties.getGraph();
        log.info("Graph store at: {}", graph.getUri());
        return GraphDatabase.driver(graph.getUri(),
                AuthTokens.basic(graph.getUsername(), graph.getPassword()));
    }
}
