package space.ketterling.climate.db;

import space.ketterling.climate.config.AppConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Creates pooled database connections using HikariCP.
 *
 * <p>
 * The API pool only reads; the import pool is short-lived and holds one long
 * insert transaction.
 * </p>
 */
public final class Database {
    private Database() {
    }

    /**
     * Builds a read-only connection pool for API requests.
     */
    public static HikariDataSource createApiDataSource(AppConfig cfg) {
        HikariConfig hc = baseConfig(cfg, "api");
        hc.setMaximumPoolSize(Math.max(2, cfg.dbApiPoolMax()));
        hc.setMinimumIdle(1);
        hc.setReadOnly(true);
        hc.setConnectionTimeout(10_000);
        return new HikariDataSource(hc);
    }

    /**
     * Builds a small pool for the measurement import. Nothing is kept idle once
     * the import is done, and a whole file may take a while to commit.
     */
    public static HikariDataSource createImportDataSource(AppConfig cfg) {
        HikariConfig hc = baseConfig(cfg, "import");
        hc.setMaximumPoolSize(Math.max(1, cfg.dbImportPoolMax()));
        hc.setMinimumIdle(0);
        hc.setConnectionTimeout(30_000);
        return new HikariDataSource(hc);
    }

    private static HikariConfig baseConfig(AppConfig cfg, String role) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(cfg.dbJdbcUrl());
        hc.setUsername(cfg.dbUsername());
        hc.setPassword(cfg.dbPassword());
        hc.setPoolName("climateapi-" + role);
        return hc;
    }
}
