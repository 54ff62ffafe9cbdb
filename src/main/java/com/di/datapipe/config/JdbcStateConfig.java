package com.di.datapipe.config;

import com.di.datapipe.state.JdbcLoadStateStore;
import com.di.datapipe.state.LoadStateStore;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

/**
 * Shared PostgreSQL marker store, enabled with {@code datapipe.state.store=jdbc}. DataSource
 * auto-configuration is excluded application-wide, so the pool is built here from
 * {@code datapipe.state.jdbc.*}.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "datapipe.state.store", havingValue = "jdbc")
public class JdbcStateConfig {

    @Bean(destroyMethod = "close")
    public HikariDataSource loadStateDataSource(PipelineProperties properties) {
        PipelineProperties.Jdbc jdbc = properties.getState().getJdbc();
        if (jdbc.getUrl() == null || jdbc.getUrl().isBlank()) {
            throw new IllegalStateException("datapipe.state.jdbc.url is required when datapipe.state.store=jdbc");
        }
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbc.getUrl());
        config.setUsername(jdbc.getUsername());
        config.setPassword(jdbc.getPassword());
        config.setDriverClassName(jdbc.getDriverClassName());
        config.setMaximumPoolSize(jdbc.getMaximumPoolSize());
        config.setConnectionTimeout(jdbc.getConnectionTimeoutMs());
        config.setPoolName("HikariPool-load-state");
        if (jdbc.getUrl().contains("postgresql")) {
            config.addDataSourceProperty("tcpKeepAlive", "true");
        }
        log.info("[POOL] Creating load-state pool maxPoolSize={}", jdbc.getMaximumPoolSize());
        return new HikariDataSource(config);
    }

    @Bean
    public JdbcTemplate loadStateJdbcTemplate(HikariDataSource loadStateDataSource) {
        new ResourceDatabasePopulator(new ClassPathResource("db/load_state.sql")).execute(loadStateDataSource);
        return new JdbcTemplate(loadStateDataSource);
    }

    @Bean
    public LoadStateStore jdbcLoadStateStore(JdbcTemplate loadStateJdbcTemplate) {
        return new JdbcLoadStateStore(loadStateJdbcTemplate);
    }
}
