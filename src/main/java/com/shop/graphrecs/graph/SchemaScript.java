package com.shop.graphrecs.graph;

import com.shop.graphrecs.config.GraphRecsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Constraint and index statements applied before any data is written.
 * The script is split on {@code ;}; blank segments and {@code //} comment lines are dropped.
 */
@Component
@Slf4j
public class SchemaScript {

    private final ResourceLoader resourceLoader;
    private final GraphRecsProperties.Schema settings;

    public SchemaScript(ResourceLoader resourceLoader, GraphRecsProperties properties) {
        this.resourceLoader = resourceLoader;
        this.settings = properties.getSchema();
    }

    /**
     * Execute every statement independently, in file order.
     *
     * @return number of statements that succeeded
     */
    public int apply(GraphWriter writer) {
        List<String> statements = statements();
        int applied = 0;
        for (String statement : statements) {
            try {
                writer.run(statement);
                applied++;
            } catch (RuntimeException e) {
                if (settings.isFailOnError()) {
                    log.error("Schema statement failed, aborting load: {}", statement, e);
                    throw e;
                }
                log.warn("Schema statement failed, continuing without it: {} ({})", statement, e.getMessage());
            }
        }
        log.info("Applied {}/{} schema statements from {}", applied, statements.size(), settings.getLocation());
        return applied;
    }

    public List<String> statements() {
        Resource resource = resourceLoader.getResource(settings.getLocation());
        String text;
        try (InputStream in = resource.getInputStream()) {
            text = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read schema script " + settings.getLocation(), e);
        }
        return split(text);
    }

    static List<String> split(String script) {
        List<String> statements = new ArrayList<>();
        for (String segment : script.split(";")) {
            String statement = segment.lines()
                    .filter(line -> !line.trim().startsWith("//"))
                    .collect(Collectors.joining("\n"))
                    .trim();
            if (!statement.isEmpty()) {
                statements.add(statement);
            }
        }
        return statements;
    }
}
