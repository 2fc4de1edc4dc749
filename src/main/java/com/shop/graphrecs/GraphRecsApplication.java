package com.shop.graphrecs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Profiles;

/**
 * Entry point for the Graph Recs application.
 *
 * With the {@code etl} profile active the pipeline runs once and the JVM exits with
 * Spring's exit code. Without it the application serves the {@code /health} probe.
 */
@SpringBootApplication
public class GraphRecsApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(GraphRecsApplication.class, args);
        if (context.getEnvironment().acceptsProfiles(Profiles.of("etl"))) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
