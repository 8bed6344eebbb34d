package com.shetka.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;

/**
 * Connection pool built from DATABASE_URL.
 * The pool is owned by the Spring context: opened at startup, closed on shutdown.
 */
@Configuration
@Slf4j
public class DataSourceConfig {

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(AppProperties properties) {
        AppProperties.Db db = properties.getDb();
        DatabaseUrlResolver.JdbcTarget target = DatabaseUrlResolver.resolve(db.getUrl());

        HikariConfig config = new HikariConfig();
        config.setPoolName("shetka-db");
        config.setJdbcUrl(target.jdbcUrl());
        if (target.username() != null) {
            config.setUsername(target.username());
        }
        if (target.password() != null) {
            config.setPassword(target.password());
        }
        config.setMaximumPoolSize(db.getPool().getMaxSize());
        config.setMinimumIdle(Math.min(db.getPool().getMinIdle(), db.getPool().getMaxSize()));

        log.info("Opening connection pool: maxSize={}, minIdle={}, dialect={}",
                config.getMaximumPoolSize(), config.getMinimumIdle(), db.getDialect());
        return new HikariDataSource(config);
    }

    @Bean
    public NamedParameterJdbcTemplate namedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }
}
