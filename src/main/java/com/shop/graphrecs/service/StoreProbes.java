package com.shop.graphrecs.service;

import lombok.RequiredArgsConstructor;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Session;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Liveness round trips against the two stores. Each call opens and releases its own
 * connection or session.
 */
@Component
@RequiredArgsConstructor
public class StoreProbes {

    public static final String SOURCE = "source";
    public static final String GRAPH = "graph";

    private final JdbcTemplate jdbcTemplate;
    private final Driver driver;

    public void checkSource() {
        jdbcTemplate.queryForObject("SELECT 1", Integer.class);
    }

    public void checkGraph() {
        try (Session session = driver.session()) {
            session.run("RETURN 1").consume();
        }
    }
}
