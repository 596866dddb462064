package space.ketterling.climate.config;

import space.ketterling.climate.query.DuplicateDatePolicy;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * This record groups all runtime settings for the API, the database pools,
 * the query window and the measurement import.
 * </p>
 */
public record AppConfig(
        // API / DB
        int apiPort,
        String dbJdbcUrl,
        String dbUsername,
        String dbPassword,
        int dbApiPoolMax,
        int dbImportPoolMax,

        // Queries
        int windowDays,
        DuplicateDatePolicy duplicatePolicy,

        // Responses
        boolean distinctErrorStatus,
        int cacheMaxAgeSeconds,
        int cacheStaleSeconds,
        int cacheMaxEntries,

        // Import
        String measurementCsv) {

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read application.properties", e);
        }

        String dbUrl = requireNonBlank("db.jdbcUrl", envOr(p, "DB_JDBC_URL", "db.jdbcUrl", ""));
        String dbUser = envOr(p, "DB_USERNAME", "db.username", "");
        String dbPass = envOr(p, "DB_PASSWORD", "db.password", ""); // ok empty if local trust auth

        int dbApiPoolMax = Integer.parseInt(envOr(p, "DB_API_POOL_MAX", "db.api.poolMax", "8"));
        int dbImportPoolMax = Integer.parseInt(envOr(p, "DB_IMPORT_POOL_MAX", "db.import.poolMax", "2"));

        int port = Integer.parseInt(envOr(p, "API_PORT", "api.port", "8080"));

        int windowDays = Integer.parseInt(envOr(p, "WINDOW_DAYS", "query.windowDays", "365"));
        if (windowDays < 1)
            throw new IllegalStateException("query.windowDays must be positive, got " + windowDays);
        DuplicateDatePolicy policy = DuplicateDatePolicy.valueOf(
                envOr(p, "PRCP_DUPLICATE_POLICY", "precipitation.duplicatePolicy", "LAST")
                        .trim().toUpperCase(Locale.ROOT));

        boolean distinctErrorStatus = Boolean.parseBoolean(
                envOr(p, "API_DISTINCT_ERROR_STATUS", "api.distinctErrorStatus", "false"));
        int cacheMaxAge = Integer.parseInt(envOr(p, "CACHE_MAX_AGE_SECONDS", "cache.maxAgeSeconds", "300"));
        int cacheStale = Integer.parseInt(envOr(p, "CACHE_STALE_SECONDS", "cache.staleSeconds", "600"));
        int cacheMaxEntries = Integer.parseInt(envOr(p, "CACHE_MAX_ENTRIES", "cache.maxEntries", "1000"));

        String measurementCsv = envOr(p, "IMPORT_MEASUREMENT_CSV", "import.measurementCsv",
                "data/hawaii_measurements.csv");

        // constructor args must match record field order
        return new AppConfig(
                port,
                dbUrl,
                dbUser,
                dbPass,
                dbApiPoolMax,
                dbImportPoolMax,

                windowDays,
                policy,

                distinctErrorStatus,
                cacheMaxAge,
                cacheStale,
                cacheMaxEntries,

                measurementCsv);
    }

    // ----------------------------
    // helpers
    // ----------------------------
    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private static String envOr(Properties p, String envKey, String propKey, String def) {
        String v = System.getenv(envKey);
        if (v != null && !v.isBlank())
            return v;
        String sys = System.getProperty(propKey);
        if (sys != null && !sys.isBlank())
            return sys;
        return p.getProperty(propKey, def);
    }

    /**
     * Ensures a required config value is present and not blank.
     */
    private static String requireNonBlank(String propKey, String v) {
        if (v == null || v.isBlank()) {
            throw new IllegalStateException(
                    "Missing required config value " + propKey + " (env var, -Dprop, or application.properties).");
        }
        return v;
    }
}
