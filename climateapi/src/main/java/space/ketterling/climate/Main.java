/*
* Copyright 2025 Taylor Ketterling
* Main application entry point for ClimateAPI, a daily climate observation query service.
*
* Loads configuration, opens the database pool, loads the measurement CSV when the
* table is still empty, and starts the API server. The pool and the server are closed
* by a shutdown hook.
*/

package space.ketterling.climate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.climate.api.ApiServer;
import space.ketterling.climate.config.AppConfig;
import space.ketterling.climate.db.Database;
import space.ketterling.climate.db.MeasurementRepo;
import space.ketterling.climate.ingest.MeasurementCsvImport;

import java.nio.file.Path;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        log.info("Starting application");
        AppConfig cfg = AppConfig.load();

        // The dataset is static; load it once before serving if the table is empty
        loadDataset(cfg);

        // opened only after the import, so a failed import leaves nothing to close
        ObjectMapper om = new ObjectMapper();
        HikariDataSource apiDs = Database.createApiDataSource(cfg);
        MeasurementRepo repo = new MeasurementRepo(apiDs);

        ApiServer api = new ApiServer(cfg, om, repo);
        api.start();
        log.info("API server started on port {}", cfg.apiPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down...");
                api.stop();
                apiDs.close();
            } catch (Exception e) {
                log.error("Shutdown error", e);
            }
        }));
    }

    /**
     * Runs the startup import on its own pool, closed before returning.
     *
     * @return rows written, 0 when the table was already populated
     */
    static int loadDataset(AppConfig cfg) throws Exception {
        try (HikariDataSource importDs = Database.createImportDataSource(cfg)) {
            MDC.put("job", "startup-import");
            int rows = MeasurementCsvImport.importIfEmpty(Path.of(cfg.measurementCsv()),
                    new MeasurementRepo(importDs));
            if (rows > 0)
                log.info("Startup import loaded {} measurement rows", rows);
            return rows;
        } finally {
            MDC.remove("job");
        }
    }
}
