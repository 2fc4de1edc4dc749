package com.shop.graphrecs.graph;

import org.neo4j.driver.Session;

import java.util.List;
import java.util.Map;

/**
 * {@link GraphWriter} over a single Neo4j session.
 * Uses auto-commit queries, so the driver does not retry a failed batch.
 */
public class Neo4jGraphWriter implements GraphWriter {

    private final Session session;

    public Neo4jGraphWriter(Session session) {
        this.session = session;
    }

    @Override
    public void run(String statement) {
        session.run(statement).consume();
    }

    @Override
    public void runBatch(String statement, List<Map<String, Object>> rows) {
        session.run(statement, Map.<String, Object>of(ROWS_PARAMETER, rows)).consume();
    }

    @Override
    public void close() {
        session.close();
    }
}
