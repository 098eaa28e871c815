package org.clerasense.infrastructure.adapter.out.postgres;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

/** Same checks as the H2 run, against a real PostgreSQL. Skipped when Docker is unavailable. */
@Testcontainers(disabledWithoutDocker = true)
class PostgresDrugStoreAdapterTest extends DrugStoreContract {

    @Container
    private static final PostgreSQLContainer<?> PG = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("clerasense");

    private static HikariDataSource pool;

    @BeforeAll
    static void openPool() {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(PG.getJdbcUrl());
        cfg.setUsername(PG.getUsername());
        cfg.setPassword(PG.getPassword());
        cfg.setMaximumPoolSize(4);
        pool = new HikariDataSource(cfg);
    }

    @AfterAll
    static void closePool() {
        if (pool != null) pool.close();
    }

    @Override
    protected DataSource dataSource() {
        return pool;
    }
}
