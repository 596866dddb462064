package space.ketterling.climate.db;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.util.UUID;

/**
 * Private in-memory H2 databases for JDBC tests.
 */
public final class TestDatabases {
    private TestDatabases() {
    }

    public static HikariDataSource newH2() {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl("jdbc:h2:mem:climate_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1");
        hc.setUsername("sa");
        hc.setPassword("");
        hc.setPoolName("climateapi-test");
        hc.setMaximumPoolSize(2);
        return new HikariDataSource(hc);
    }
}
