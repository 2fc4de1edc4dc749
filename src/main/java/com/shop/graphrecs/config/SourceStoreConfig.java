package com.shop.graphrecs.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;

import javax.sql.DataSource;
import java.util.Properties;

/**
 * Source store (PostgreSQL) configuration.
 * The DataSource does not pool: every acquisition opens a fresh connection, which keeps
 * the extraction and the liveness probes one-shot round trips.
 */
@Configuration
@EnableTransactionManagement
@Slf4j
public class SourceStoreConfig {

    @Bean
    public DataSource sourceDataSource(GraphRecsProperties properties) {
        SourceConnectionUrl url = SourceConnectionUrl.parse(properties.getSource().getUrl());
        log.info("Source store at: {}", url.getJdbcUrl());

        DriverManagerDataSource dataSource = new DriverManagerDataSource(url.getJdbcUrl());
        dataSource.setDriverClassName("org.postgresql.Driver");
        if (url.getUsername() != null) {
            dataSource.setUsername(url.getUsername());
        }
        if (url.getPassword() != null) {
            dataSource.setPassword(url.getPassword());
        }
        Properties connectionProperties = new Properties();
        connectionProperties.setProperty("loginTimeout",
                String.valueOf(properties.getSource().getLoginTimeoutSeconds()));
        dataSource.setConnectionProperties(connectionProperties);
        return dataSource;
    }

    @Bean
    public JdbcTemplate sourceJdbcTemplate(DataSource sourceDataSource) {
        return new JdbcTemplate(sourceDataSource);
    }

    /**
     * Primary transaction manager, used by the read-only extraction transaction
     */
    @Primary
    @Bean(name = "transactionManager")
    public PlatformTransactionManager transactionManager(DataSource sourceDataSource) {
        return new DataSourceTransactionManager(sourceDataSource);
    }
}
