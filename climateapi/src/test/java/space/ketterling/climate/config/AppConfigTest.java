package space.ketterling.climate.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import space.ketterling.climate.query.DuplicateDatePolicy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AppConfigTest {
    private static final String[] KEYS = {
            "api.port", "db.jdbcUrl", "query.windowDays", "precipitation.duplicatePolicy",
            "api.distinctErrorStatus", "cache.maxAgeSeconds"
    };

    @AfterEach
    void clearProperties() {
        for (String k : KEYS)
            System.clearProperty(k);
    }

    @Test
    void defaultsComeFromApplicationProperties() {
        AppConfig cfg = AppConfig.load();

        assertThat(cfg.apiPort()).isEqualTo(8080);
        assertThat(cfg.dbJdbcUrl()).startsWith("jdbc:");
        assertThat(cfg.windowDays()).isEqualTo(365);
        assertThat(cfg.duplicatePolicy()).isEqualTo(DuplicateDatePolicy.LAST);
        assertThat(cfg.distinctErrorStatus()).isFalse();
        assertThat(cfg.cacheMaxAgeSeconds()).isEqualTo(300);
        assertThat(cfg.cacheMaxEntries()).isEqualTo(1000);
    }

    @Test
    void systemPropertiesOverrideFileValues() {
        System.setProperty("api.port", "9090");
        System.setProperty("db.jdbcUrl", "jdbc:h2:mem:override");
        System.setProperty("query.windowDays", "30");
        System.setProperty("precipitation.duplicatePolicy", "mean");
        System.setProperty("api.distinctErrorStatus", "true");
        System.setProperty("cache.maxAgeSeconds", "0");

        AppConfig cfg = AppConfig.load();

        assertThat(cfg.apiPort()).isEqualTo(9090);
        assertThat(cfg.dbJdbcUrl()).isEqualTo("jdbc:h2:mem:override");
        assertThat(cfg.windowDays()).isEqualTo(30);
        assertThat(cfg.duplicatePolicy()).isEqualTo(DuplicateDatePolicy.MEAN);
        assertThat(cfg.distinctErrorStatus()).isTrue();
        assertThat(cfg.cacheMaxAgeSeconds()).isZero();
    }

    @Test
    void unknownDuplicatePolicyIsRejected() {
        System.setProperty("precipitation.duplicatePolicy", "median");

        assertThatThrownBy(AppConfig::load).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nonPositiveWindowIsRejected() {
        System.setProperty("query.windowDays", "0");

        assertThatThrownBy(AppConfig::load)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("query.windowDays");
    }
}
