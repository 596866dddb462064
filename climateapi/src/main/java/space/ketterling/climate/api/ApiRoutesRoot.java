package space.ketterling.climate.api;

import io.javalin.Javalin;
import space.ketterling.climate.db.ObservationRepository;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root and health endpoints for the API.
 */
final class ApiRoutesRoot {
    static final String INDEX = "Available Routes:<br/>"
            + "/api/v1.0/precipitation<br/>"
            + "/api/v1.0/stations<br/>"
            + "/api/v1.0/tobs<br/>"
            + "/api/v1.0/&lt;start&gt;<br/>"
            + "/api/v1.0/&lt;start&gt;/&lt;end&gt;";

    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesRoot() {
    }

    /**
     * Registers root and health endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        ObservationRepository repo = api.repo();

        app.get("/", ctx -> api.respondText(ctx, 200, INDEX));

        app.get("/health", ctx -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("status", "ok");
            out.put("time", OffsetDateTime.now().toString());

            try {
                LocalDate latest = repo.maxDate();
                out.put("db", "ok");
                out.put("latest_date", latest == null ? null : latest.toString());
            } catch (Exception e) {
                out.put("db", "fail");
                out.put("db_error", e.getMessage());
                ctx.status(503);
            }

            ctx.json(out);
        });
    }
}
