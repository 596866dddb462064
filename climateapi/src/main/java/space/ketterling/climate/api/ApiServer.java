/*
* Copyright 2025 Taylor Ketterling
* API Server for ClimateAPI, a daily climate observation query service.
* utilizes Javalin for HTTP server and provides the /api/v1.0 query endpoints.
* uses Jackson for JSON processing over a read-only observation repository.
*/

package space.ketterling.climate.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.climate.config.AppConfig;
import space.ketterling.climate.db.ObservationRepository;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final ObservationRepository repo;
    private Javalin app;
    private final Map<String, CachedResponse> responseCache = new ConcurrentHashMap<>();

    public ApiServer(AppConfig cfg, ObjectMapper om, ObservationRepository repo) {
        this.cfg = cfg;
        this.om = om;
        this.repo = repo;
    }

    /**
     * Creates the Javalin app with all routes registered, without binding a
     * port.
     */
    public Javalin build() {
        app = Javalin.create(j -> {
            j.http.defaultContentType = "application/json";
            j.bundledPlugins.enableCors(cors -> cors.addRule(r -> r.anyHost()));
        });

        // Basic request logging + record start time for latency measurement
        app.before(ctx -> {
            ctx.attribute("startTime", System.currentTimeMillis());
            log.info("Incoming {} {} from {}", ctx.method(), ctx.path(), ctx.ip());
        });

        app.after(ctx -> {
            Long t0 = ctx.attribute("startTime");
            long ms = (t0 == null) ? -1 : (System.currentTimeMillis() - t0);
            log.info("Handled {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
        });

        // JSON error instead of the default HTML error page
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(om.createObjectNode()
                    .put("error", "internal_error")
                    .put("message", e.getMessage() == null ? "Unknown error" : e.getMessage()));
        });

        ApiRoutesRoot.register(this);
        // static /api/v1.0 paths must be registered before /api/v1.0/{start}
        ApiRoutesClimate.register(this);
        return app;
    }

    public void start() {
        log.info("Starting API server on port {}", cfg.apiPort());
        build().start(cfg.apiPort());
    }

    public void stop() {
        if (app != null)
            app.stop();
        log.info("API server stopped");
    }

    Javalin app() {
        return app;
    }

    ObjectMapper om() {
        return om;
    }

    AppConfig cfg() {
        return cfg;
    }

    ObservationRepository repo() {
        return repo;
    }

    // --------------------------------------------------------------------
    // Helpers
    // --------------------------------------------------------------------
    private static class CachedResponse {
        final String body;
        final long expiresAt;
        final String etag;

        CachedResponse(String body, long expiresAt, String etag) {
            this.body = body;
            this.expiresAt = expiresAt;
            this.etag = etag;
        }
    }

    /**
     * Answers from the response cache when a fresh entry exists. Returns false
     * when the handler must compute the response.
     */
    boolean serveCached(Context ctx, String key) {
        CachedResponse cached = responseCache.get(key);
        if (cached == null) {
            return false;
        }
        long now = System.currentTimeMillis();
        if (cached.expiresAt <= now) {
            responseCache.remove(key);
            return false;
        }

        applyCacheHeaders(ctx);
        ctx.header("ETag", cached.etag);
        String inm = ctx.header("If-None-Match");
        if (cached.etag.equals(inm)) {
            ctx.status(304);
            return true;
        }

        ctx.contentType("application/json");
        ctx.result(cached.body);
        return true;
    }

    /**
     * Serializes {@code node}, stores it under {@code key} and writes it with
     * cache headers. Caching is off when the configured max age is not
     * positive.
     */
    void cacheAndRespond(Context ctx, String key, JsonNode node) throws Exception {
        String body = om.writeValueAsString(node);
        int maxAgeSeconds = cfg.cacheMaxAgeSeconds();
        if (maxAgeSeconds > 0) {
            String etag = "\"" + Integer.toHexString(body.hashCode()) + "\"";
            long now = System.currentTimeMillis();
            long expiresAt = now + (maxAgeSeconds * 1000L);
            if (hasRoomFor(key, now)) {
                responseCache.put(key, new CachedResponse(body, expiresAt, etag));
            }
            applyCacheHeaders(ctx);
            ctx.header("ETag", etag);
        }
        ctx.contentType("application/json");
        ctx.result(body);
    }

    /**
     * Range keys carry caller text, so the cache is capped. Expired entries are
     * swept once the cap is reached; a still-full cache stores nothing new.
     */
    private boolean hasRoomFor(String key, long now) {
        int max = cfg.cacheMaxEntries();
        if (responseCache.containsKey(key) || responseCache.size() < max) {
            return true;
        }
        responseCache.values().removeIf(c -> c.expiresAt <= now);
        if (responseCache.size() < max) {
            return true;
        }
        log.debug("Response cache full ({} entries), not caching {}", responseCache.size(), key);
        return false;
    }

    int cachedResponseCount() {
        return responseCache.size();
    }

    private void applyCacheHeaders(Context ctx) {
        if (cfg.cacheMaxAgeSeconds() <= 0) {
            return;
        }
        StringBuilder sb = new StringBuilder("public, max-age=").append(cfg.cacheMaxAgeSeconds());
        if (cfg.cacheStaleSeconds() > 0) {
            sb.append(", stale-while-revalidate=").append(cfg.cacheStaleSeconds());
        }
        ctx.header("Cache-Control", sb.toString());
    }

    /**
     * Writes a text answer for a request that was understood but could not be
     * served (bad input, nothing matched).
     */
    void respondText(Context ctx, int status, String message) {
        ctx.status(status);
        ctx.contentType("text/html; charset=utf-8");
        ctx.result(message);
    }

    void putNullable(ObjectNode obj, String key, Double value) {
        if (value == null)
            obj.putNull(key);
        else
            obj.put(key, value);
    }

    void addNullable(ArrayNode arr, Double value) {
        if (value == null)
            arr.addNull();
        else
            arr.add(value);
    }
}
