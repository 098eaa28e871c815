package org.clerasense.infrastructure.adapter.out.postgres;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeAll;

import javax.sql.DataSource;

/** Runs the store against H2 in PostgreSQL mode, no Docker needed. */
class H2DrugStoreAdapterTest extends DrugStoreContract {

    private static JdbcDataSource ds;

    @BeforeAll
    static void createDb() {
        ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:drugstore;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        ds.setUser("sa");
        ds.setPassword("");
    }

    @Override
    protected DataSource dataSource() {
        return ds;
    }
}
