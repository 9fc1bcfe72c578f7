/*
* Copyright 2025 Taylor Ketterling
* Compute engine client for geoanalysis, a guarded geospatial analysis service.
* Utilizes Java HttpClient for calls to the remote compute engine's JSON API
* and Jackson for JSON processing.
*/

package space.ketterling.geoanalysis.compute;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.geoanalysis.config.AppConfig;
import space.ketterling.geoanalysis.geo.BoundingBox;
import space.ketterling.geoanalysis.metrics.ExternalApiMetrics;
import space.ketterling.geoanalysis.plan.Reducer;

import java.net.URI;
import java.net.http.*;
import java.time.Duration;

/**
 * HTTP client for the remote compute engine.
 *
 * <p>
 * Retries 429 and 5xx responses with exponential backoff, honours
 * {@code Retry-After}, and trips a circuit breaker after repeated failures.
 * A request counts once toward the breaker, and only after its retries are
 * used up, so a few failing buckets do not shut out their siblings.
 * </p>
 */
public final class ComputeEngineClient implements ComputeEngine {
    private static final Logger log = LoggerFactory.getLogger(ComputeEngineClient.class);

    private static final double MAX_PIXELS = 1e9;
    private static final long CB_WINDOW_MS = 60_000L;

    private final HttpClient http;
    private final ObjectMapper om;
    private final String baseUrl;
    private final String token;
    private final Duration requestTimeout;
    private final int maxAttempts;
    private final long initialBackoffMs;
    private final int cbThreshold;
    private final long cbCoolDownMs;

    // Circuit-breaker state, per client instance
    private int cbFailureCount = 0;
    private long cbFirstFailureTs = 0L;
    private boolean cbOpen = false;
    private long cbOpenUntil = 0L;

    public ComputeEngineClient(AppConfig cfg, ObjectMapper om) {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(),
                om, cfg.computeBaseUrl(), cfg.computeToken(), cfg.computeRequestTimeout(), cfg.computeMaxAttempts(),
                1000L, cfg.computeCircuitThreshold(), cfg.computeCircuitCoolDown().toMillis());
    }

    ComputeEngineClient(HttpClient http, ObjectMapper om, String baseUrl, String token, Duration requestTimeout,
            int maxAttempts, long initialBackoffMs, int cbThreshold, long cbCoolDownMs) {
        this.http = http;
        this.om = om;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token = token;
        this.requestTimeout = requestTimeout;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = initialBackoffMs;
        this.cbThreshold = cbThreshold;
        this.cbCoolDownMs = cbCoolDownMs;
    }

    @Override
    public Double reduceRegion(ImageSpec image, Reducer reducer, BoundingBox region, int scaleMeters) {
        ObjectNode body = om.createObjectNode();
        body.set("image", imageJson(image));
        body.put("reducer", reducer.wireName());
        body.set("region", bboxJson(region));
        body.put("scale", scaleMeters);
        body.put("maxPixels", MAX_PIXELS);

        JsonNode resp = postJson("/v1/reduce", body);
        JsonNode v = resp.path("result").path(image.outputBand());
        if (v.isMissingNode() || v.isNull())
            return null;
        if (!v.isNumber())
            throw new RemoteComputeException("Compute engine returned a non-numeric value for band "
                    + image.outputBand());
        return v.asDouble();
    }

    @Override
    public MapLayer getMap(ImageSpec image, VisParams vis) {
        ObjectNode body = om.createObjectNode();
        body.set("image", imageJson(image));
        ObjectNode v = body.putObject("vis");
        v.put("min", vis.min());
        v.put("max", vis.max());
        ArrayNode palette = v.putArray("palette");
        vis.palette().forEach(palette::add);

        JsonNode resp = postJson("/v1/maps", body);
        String url = resp.path("urlFormat").asText(null);
        if (url == null || url.isBlank())
            throw new RemoteComputeException("Compute engine returned no map url");
        return new MapLayer(url);
    }

    ObjectNode imageJson(ImageSpec image) {
        ObjectNode n = om.createObjectNode();
        if (image instanceof CompositeSpec) {
            CompositeSpec c = (CompositeSpec) image;
            n.put("type", "composite");
            n.put("reducer", c.temporalReducer().wireName());
            CollectionQuery q = c.query();
            ObjectNode col = n.putObject("collection");
            col.put("id", q.collectionId());
            col.put("band", q.band());
            if (q.bandExpression() != null)
                col.put("expression", q.bandExpression());
            col.set("bounds", bboxJson(q.bounds()));
            col.put("start", q.start().toString());
            col.put("end", q.endExclusive().toString());
            if (q.maxCloudPercent() != null)
                col.put("maxCloudPercent", q.maxCloudPercent());
            ArrayNode steps = col.putArray("preprocessing");
            q.preprocessing().forEach(steps::add);
        } else if (image instanceof DifferenceSpec) {
            DifferenceSpec d = (DifferenceSpec) image;
            n.put("type", "difference");
            n.set("after", imageJson(d.after()));
            n.set("before", imageJson(d.before()));
        } else {
            throw new IllegalArgumentException("Unsupported image spec: " + image.getClass().getName());
        }
        return n;
    }

    private ArrayNode bboxJson(BoundingBox b) {
        ArrayNode arr = om.createArrayNode();
        for (double v : b.toArray())
            arr.add(v);
        return arr;
    }

    /**
     * POSTs a JSON body and parses the response, with retries.
     */
    private JsonNode postJson(String path, JsonNode body) {
        String url = baseUrl + path;
        String payload;
        try {
            payload = om.writeValueAsString(body);
        } catch (Exception e) {
            throw new RemoteComputeException("Unable to encode compute request", e);
        }

        long backoffMs = initialBackoffMs;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (isCircuitOpen()) {
                log.warn("Compute circuit-breaker open, skipping request to {}", url);
                throw new RemoteComputeException("Compute engine unavailable (circuit open)");
            }

            HttpRequest.Builder rb = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(payload));
            if (token != null && !token.isBlank())
                rb.header("Authorization", "Bearer " + token);

            long t0 = System.currentTimeMillis();
            try {
                log.debug("Compute request -> {} attempt={}", url, attempt);
                HttpResponse<String> resp = http.send(rb.build(), HttpResponse.BodyHandlers.ofString());
                long elapsed = System.currentTimeMillis() - t0;
                int code = resp.statusCode();
                if (code >= 200 && code < 300) {
                    ExternalApiMetrics.record(ExternalApiMetrics.COMPUTE, true, elapsed);
                    recordSuccess();
                    return om.readTree(resp.body());
                }

                ExternalApiMetrics.record(ExternalApiMetrics.COMPUTE, false, elapsed);
                if (code != 429 && (code < 500 || code >= 600)) {
                    throw new RemoteComputeException("Compute request failed: " + code + " path=" + path
                            + " body=" + abbreviate(resp.body()));
                }

                if (attempt == maxAttempts) {
                    recordFailure();
                    throw new RemoteComputeException("Compute request failed: " + code + " path=" + path
                            + " after " + attempt + " attempts");
                }
                log.warn("Compute transient failure code={} path={} attempt={}", code, path, attempt);
                long retryAfterMs = retryAfterMillis(resp);
                if (retryAfterMs > 0) {
                    log.warn("Compute engine asked to Retry-After {}ms for path={}", retryAfterMs, path);
                    Thread.sleep(retryAfterMs);
                    continue;
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new RemoteComputeException("Interrupted while calling compute engine", ie);
            } catch (RemoteComputeException e) {
                throw e;
            } catch (Exception e) {
                ExternalApiMetrics.record(ExternalApiMetrics.COMPUTE, false, System.currentTimeMillis() - t0);
                log.warn("Compute request exception path={} attempt={} err={}", path, attempt, e.toString());
                if (attempt == maxAttempts) {
                    recordFailure();
                    throw new RemoteComputeException("Compute request failed: " + e.getMessage(), e);
                }
            }

            try {
                Thread.sleep(backoffMs);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new RemoteComputeException("Interrupted while backing off", ie);
            }
            backoffMs *= 2;
        }
        throw new RemoteComputeException("Compute request failed after retries: " + path);
    }

    private static long retryAfterMillis(HttpResponse<String> resp) {
        String ra = resp.headers().firstValue("Retry-After").orElse(null);
        if (ra == null)
            return 0L;
        try {
            return Math.max(0L, Long.parseLong(ra.trim())) * 1000L;
        } catch (NumberFormatException nfe) {
            // HTTP-date form, use normal backoff
            return 0L;
        }
    }

    private static String abbreviate(String s) {
        if (s == null)
            return "";
        return s.length() <= 300 ? s : s.substring(0, 300) + "...";
    }

    private synchronized boolean isCircuitOpen() {
        if (!cbOpen)
            return false;
        if (System.currentTimeMillis() > cbOpenUntil) {
            cbOpen = false;
            cbFailureCount = 0;
            cbFirstFailureTs = 0L;
            log.info("Compute circuit-breaker half-open after cool-down");
            return false;
        }
        return true;
    }

    private synchronized void recordFailure() {
        long now = System.currentTimeMillis();
        if (cbFirstFailureTs == 0L || (now - cbFirstFailureTs) > CB_WINDOW_MS) {
            cbFirstFailureTs = now;
            cbFailureCount = 1;
        } else {
            cbFailureCount += 1;
        }
        if (!cbOpen && cbFailureCount >= cbThreshold) {
            cbOpen = true;
            cbOpenUntil = now + cbCoolDownMs;
            log.warn("Compute circuit-breaker OPEN after {} failed requests within {}ms", cbFailureCount,
                    CB_WINDOW_MS);
        }
    }

    private synchronized void recordSuccess() {
        cbFailureCount = 0;
        cbFirstFailureTs = 0L;
        if (cbOpen) {
            cbOpen = false;
            cbOpenUntil = 0L;
            log.info("Compute circuit-breaker CLOSED after successful request");
        }
    }
}
