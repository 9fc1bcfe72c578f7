package space.ketterling.geoanalysis.geo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.geoanalysis.config.AppConfig;
import space.ketterling.geoanalysis.metrics.ExternalApiMetrics;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Geocoder backed by the OpenStreetMap Nominatim search API.
 *
 * <p>
 * Nominatim's usage policy requires an identifying {@code User-Agent}; it is
 * taken from {@link AppConfig#geocoderUserAgent()}.
 * </p>
 */
public final class NominatimGeocoder implements Geocoder {
    private static final Logger log = LoggerFactory.getLogger(NominatimGeocoder.class);

    private final HttpClient http;
    private final ObjectMapper om;
    private final String searchUrl;
    private final String userAgent;
    private final Duration timeout;

    public NominatimGeocoder(AppConfig cfg, ObjectMapper om) {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), om, cfg.geocoderUrl(), cfg.geocoderUserAgent(), cfg.geocoderTimeout());
    }

    NominatimGeocoder(HttpClient http, ObjectMapper om, String searchUrl, String userAgent, Duration timeout) {
        this.http = http;
        this.om = om;
        this.searchUrl = searchUrl;
        this.userAgent = userAgent;
        this.timeout = timeout;
    }

    @Override
    public BoundingBox geocode(String placeName) throws Exception {
        String url = searchUrl
                + "?q=" + URLEncoder.encode(placeName, StandardCharsets.UTF_8)
                + "&format=json&limit=1&featuretype=city";
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", "application/json")
                .GET()
                .build();

        log.debug("Nominatim request -> {}", url);
        long t0 = System.currentTimeMillis();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (Exception e) {
            ExternalApiMetrics.record(ExternalApiMetrics.NOMINATIM, false, System.currentTimeMillis() - t0);
            throw e;
        }
        long elapsed = System.currentTimeMillis() - t0;
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            ExternalApiMetrics.record(ExternalApiMetrics.NOMINATIM, false, elapsed);
            throw new IllegalStateException("Nominatim request failed: " + resp.statusCode() + " q=" + placeName);
        }
        ExternalApiMetrics.record(ExternalApiMetrics.NOMINATIM, true, elapsed);
        return parseFirstBox(om.readTree(resp.body()), placeName);
    }

    /**
     * Reads the first hit's {@code boundingbox}, which Nominatim orders
     * {@code [minlat, maxlat, minlon, maxlon]} as strings.
     */
    static BoundingBox parseFirstBox(JsonNode results, String placeName) {
        if (results == null || !results.isArray() || results.size() == 0) {
            throw new IllegalStateException("No results found for \"" + placeName + "\"");
        }
        JsonNode bb = results.get(0).path("boundingbox");
        if (!bb.isArray() || bb.size() != 4) {
            throw new IllegalStateException("Nominatim result has no boundingbox for \"" + placeName + "\"");
        }
        double minLat = Double.parseDouble(bb.get(0).asText());
        double maxLat = Double.parseDouble(bb.get(1).asText());
        double minLon = Double.parseDouble(bb.get(2).asText());
        double maxLon = Double.parseDouble(bb.get(3).asText());
        return new BoundingBox(minLon, minLat, maxLon, maxLat);
    }
}
