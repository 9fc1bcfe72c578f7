package space.ketterling.geoanalysis.config;

import java.io.InputStream;
import java.time.*;
import java.util.*;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * This record groups all runtime settings for the API, the guardrail policy,
 * the result cache, the geocoder, the remote compute engine and the bucket
 * worker pool.
 * </p>
 */
public record AppConfig(
        // API
        int apiPort,
        boolean exposeErrorDetails,

        // Guardrails
        double maxTimeRangeYears,
        double maxAoiDegrees,
        List<String> allowedAnalysisTypes,
        List<String> allowedDataProducts,
        List<String> allowedDatasetIds,

        // Result cache
        int cacheMaxEntries,
        Duration cacheTtl,

        // Geocoder (Nominatim)
        boolean geocoderEnabled,
        String geocoderUrl,
        String geocoderUserAgent,
        Duration geocoderTimeout,

        // Remote compute engine
        String computeBaseUrl,
        String computeToken,
        Duration computeRequestTimeout,
        int computeMaxAttempts,
        int computeCircuitThreshold,
        Duration computeCircuitCoolDown,

        // Bucket fan-out
        int workerPoolSize,
        Duration bucketTimeout,
        Duration requestDeadline,

        // Time
        ZoneId clockZoneId) {

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (Exception e) {
            throw new IllegalStateException("Unable to read application.properties", e);
        }
        return fromProperties(p);
    }

    /**
     * Builds configuration from a properties fallback; env and -D values still
     * take precedence.
     */
    public static AppConfig fromProperties(Properties p) {
        int port = Integer.parseInt(envOr(p, "API_PORT", "api.port", "8080"));
        boolean exposeDetails = Boolean.parseBoolean(envOr(p, "API_EXPOSE_ERROR_DETAILS", "api.exposeErrorDetails",
                "false"));

        double maxYears = Double.parseDouble(envOr(p, "GUARDRAIL_MAX_YEARS", "guardrail.maxTimeRangeYears", "5"));
        double maxAoi = Double.parseDouble(envOr(p, "GUARDRAIL_MAX_AOI_DEGREES", "guardrail.maxAoiDegrees", "10"));
        List<String> analysisTypes = parseList(envOr(p, "GUARDRAIL_ANALYSIS_TYPES", "guardrail.analysisTypes",
                "timeseries,change,anomaly,seasonal_trend,single_date_map,zonal_statistics"));
        List<String> dataProducts = parseList(envOr(p, "GUARDRAIL_DATA_PRODUCTS", "guardrail.dataProducts",
                "vegetation,water,temperature,precipitation,air_quality"));
        // empty = every catalog id
        List<String> datasetIds = parseList(envOr(p, "GUARDRAIL_DATASET_IDS", "guardrail.datasetIds", ""));

        int cacheMax = Integer.parseInt(envOr(p, "CACHE_MAX_ENTRIES", "cache.maxEntries", "100"));
        Duration cacheTtl = Duration.parse(envOr(p, "CACHE_TTL", "cache.ttl", "PT1H"));

        boolean geocoderEnabled = Boolean.parseBoolean(envOr(p, "GEOCODER_ENABLED", "geocoder.enabled", "true"));
        String geocoderUrl = envOr(p, "GEOCODER_URL", "geocoder.url", "https://nominatim.openstreetmap.org/search");
        String geocoderUa = requireNonBlank(envOr(p, "GEOCODER_USER_AGENT", "geocoder.userAgent",
                "geoanalysis/1.0"));
        Duration geocoderTimeout = Duration.parse(envOr(p, "GEOCODER_TIMEOUT", "geocoder.timeout", "PT10S"));

        String computeUrl = envOr(p, "COMPUTE_BASE_URL", "compute.baseUrl", "http://localhost:8090");
        String computeToken = envOr(p, "COMPUTE_TOKEN", "compute.token", "");
        Duration computeTimeout = Duration.parse(envOr(p, "COMPUTE_REQUEST_TIMEOUT", "compute.requestTimeout",
                "PT60S"));
        int computeAttempts = Integer.parseInt(envOr(p, "COMPUTE_MAX_ATTEMPTS", "compute.maxAttempts", "3"));
        int cbThreshold = Integer.parseInt(envOr(p, "COMPUTE_CB_THRESHOLD", "compute.circuitThreshold", "10"));
        Duration cbCoolDown = Duration.parse(envOr(p, "COMPUTE_CB_COOL_DOWN", "compute.circuitCoolDown", "PT5M"));

        int poolSize = Integer.parseInt(envOr(p, "WORKER_POOL_SIZE", "workers.poolSize", "4"));
        Duration bucketTimeout = Duration.parse(envOr(p, "BUCKET_TIMEOUT", "workers.bucketTimeout", "PT90S"));
        Duration deadline = Duration.parse(envOr(p, "REQUEST_DEADLINE", "workers.requestDeadline", "PT10M"));

        ZoneId zoneId = ZoneId.of(envOr(p, "CLOCK_ZONE", "clock.zone", "UTC"));

        if (poolSize < 1)
            throw new IllegalStateException("workers.poolSize must be at least 1");
        if (cacheMax < 1)
            throw new IllegalStateException("cache.maxEntries must be at least 1");

        // constructor args must match record field order
        return new AppConfig(
                port,
                exposeDetails,

                maxYears,
                maxAoi,
                analysisTypes,
                dataProducts,
                datasetIds,

                cacheMax,
                cacheTtl,

                geocoderEnabled,
                geocoderUrl,
                geocoderUa,
                geocoderTimeout,

                computeUrl,
                computeToken,
                computeTimeout,
                computeAttempts,
                cbThreshold,
                cbCoolDown,

                poolSize,
                bucketTimeout,
                deadline,

                zoneId);
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
    private static String requireNonBlank(String v) {
        if (v == null || v.isBlank()) {
            throw new IllegalStateException(
                    "Missing required config value (env var, -Dprop, or application.properties).");
        }
        return v;
    }

    /**
     * Parses a comma separated list, dropping blanks.
     */
    private static List<String> parseList(String s) {
        if (s == null || s.isBlank())
            return List.of();
        List<String> out = new ArrayList<>();
        for (String part : s.split(",")) {
            String t = part.trim();
            if (!t.isEmpty())
                out.add(t);
        }
        return List.copyOf(out);
    }
}
