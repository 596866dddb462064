package space.ketterling.climate.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import io.javalin.http.Context;
import space.ketterling.climate.config.AppConfig;
import space.ketterling.climate.db.ObservationRepository;
import space.ketterling.climate.model.DateRange;
import space.ketterling.climate.model.PrecipitationSeries;
import space.ketterling.climate.model.TemperatureStats;
import space.ketterling.climate.query.DateRangeValidator;
import space.ketterling.climate.query.PrecipitationSeriesBuilder;
import space.ketterling.climate.query.RecentObservationsQuery;
import space.ketterling.climate.query.StationCatalog;
import space.ketterling.climate.query.TemperatureAggregator;
import space.ketterling.climate.query.TrailingWindow;
import space.ketterling.climate.query.ValidationException;

import java.util.Optional;

/**
 * Routes under /api/v1.0: precipitation, stations, tobs and temperature
 * ranges.
 *
 * <p>
 * Bad dates and empty ranges answer with a text message. The status is 200
 * unless {@code api.distinctErrorStatus} is set, which switches to 400 and 404.
 * </p>
 */
final class ApiRoutesClimate {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesClimate() {
    }

    /**
     * Registers the /api/v1.0 endpoints. Static paths go first so they are
     * never read as a start date.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        AppConfig cfg = api.cfg();
        ObservationRepository repo = api.repo();

        TrailingWindow window = new TrailingWindow(cfg.windowDays());
        PrecipitationSeriesBuilder precipitation = new PrecipitationSeriesBuilder(window, cfg.duplicatePolicy());
        RecentObservationsQuery recent = new RecentObservationsQuery(window);
        StationCatalog stations = new StationCatalog();
        DateRangeValidator validator = new DateRangeValidator();
        TemperatureAggregator aggregator = new TemperatureAggregator();

        int badRequest = cfg.distinctErrorStatus() ? 400 : 200;
        int noMatch = cfg.distinctErrorStatus() ? 404 : 200;

        app.get("/api/v1.0/precipitation", ctx -> {
            String cacheKey = "precipitation";
            if (api.serveCached(ctx, cacheKey)) {
                return;
            }

            PrecipitationSeries series = precipitation.build(repo);
            ObjectNode out = om.createObjectNode();
            for (var e : series.entries().entrySet()) {
                api.putNullable(out, e.getKey().toString(), e.getValue());
            }
            api.cacheAndRespond(ctx, cacheKey, out);
        });

        app.get("/api/v1.0/stations", ctx -> {
            String cacheKey = "stations";
            if (api.serveCached(ctx, cacheKey)) {
                return;
            }

            ArrayNode arr = om.createArrayNode();
            for (String s : stations.listStations(repo)) {
                arr.add(s);
            }
            api.cacheAndRespond(ctx, cacheKey, arr);
        });

        app.get("/api/v1.0/tobs", ctx -> {
            String cacheKey = "tobs";
            if (api.serveCached(ctx, cacheKey)) {
                return;
            }

            ArrayNode arr = om.createArrayNode();
            for (Double t : recent.recentTemperatures(repo)) {
                api.addNullable(arr, t);
            }
            api.cacheAndRespond(ctx, cacheKey, arr);
        });

        app.get("/api/v1.0/{start}", ctx -> {
            String start = ctx.pathParam("start");
            DateRange range;
            try {
                range = validator.validate(start);
            } catch (ValidationException e) {
                api.respondText(ctx, badRequest, e.getMessage());
                return;
            }

            String cacheKey = rangeKey(range);
            if (api.serveCached(ctx, cacheKey)) {
                return;
            }

            Optional<TemperatureStats> stats = aggregator.aggregate(repo, range);
            if (stats.isEmpty()) {
                api.respondText(ctx, noMatch, noMatchMessage(start));
                return;
            }
            respondStats(api, om, ctx, cacheKey, stats.get());
        });

        app.get("/api/v1.0/{start}/{end}", ctx -> {
            String start = ctx.pathParam("start");
            String end = ctx.pathParam("end");
            DateRange range;
            try {
                range = validator.validate(start, end);
            } catch (ValidationException e) {
                api.respondText(ctx, badRequest, e.getMessage());
                return;
            }

            // normalized bounds, so reversed requests share an entry
            String cacheKey = rangeKey(range);
            if (api.serveCached(ctx, cacheKey)) {
                return;
            }

            Optional<TemperatureStats> stats = aggregator.aggregate(repo, range);
            if (stats.isEmpty()) {
                api.respondText(ctx, noMatch, noMatchMessage(start, end));
                return;
            }
            respondStats(api, om, ctx, cacheKey, stats.get());
        });
    }

    private static void respondStats(ApiServer api, ObjectMapper om, Context ctx, String cacheKey,
            TemperatureStats stats) throws Exception {
        ArrayNode arr = om.createArrayNode();
        for (double v : stats.asList()) {
            arr.add(v);
        }
        api.cacheAndRespond(ctx, cacheKey, arr);
    }

    /**
     * Cache key for a temperature range. Bounds are free text past the date
     * prefix, so the start is length-prefixed and open ranges use their own
     * namespace.
     */
    static String rangeKey(DateRange range) {
        if (range.isOpen())
            return "temps-open:" + range.start();
        return "temps-range:" + range.start().length() + ":" + range.start() + ":" + range.end();
    }

    static String noMatchMessage(String start) {
        return "Your search of " + start + " did not match any records. "
                + "Please, search for an earlier date.<br/>";
    }

    static String noMatchMessage(String start, String end) {
        return "Your search beginning with '" + start + "' and ending with '" + end + "' "
                + "did not match any records.  Please, search for a different date range.<br/>";
    }
}
