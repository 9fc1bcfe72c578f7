package space.ketterling.geoanalysis.metrics;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks outcomes and latency of calls to the remote compute engine and the
 * geocoder.
 *
 * <p>
 * Uses a rolling 60-minute window of per-minute buckets to compute a health
 * status per service.
 * </p>
 */
public final class ExternalApiMetrics {
    public static final String COMPUTE = "COMPUTE";
    public static final String NOMINATIM = "NOMINATIM";

    private static final int WINDOW_MINUTES = 60;
    private static final Map<String, ServiceBuckets> SERVICES = new ConcurrentHashMap<>();

    private ExternalApiMetrics() {
    }

    /**
     * Records one call outcome and its wall-clock duration.
     */
    public static void record(String service, boolean success, long elapsedMs) {
        if (service == null || service.isBlank())
            return;
        SERVICES.computeIfAbsent(service, k -> new ServiceBuckets()).record(success, Math.max(0L, elapsedMs),
                System.currentTimeMillis() / 60000L);
    }

    /**
     * Snapshot by service name, sorted for stable output.
     */
    public static Map<String, ServiceSnapshot> snapshot() {
        long nowMin = System.currentTimeMillis() / 60000L;
        Map<String, ServiceSnapshot> out = new TreeMap<>();
        for (var e : SERVICES.entrySet()) {
            out.put(e.getKey(), e.getValue().snapshot(nowMin));
        }
        return out;
    }

    public static int windowMinutes() {
        return WINDOW_MINUTES;
    }

    /**
     * Drops all recorded calls. Used by tests.
     */
    public static void reset() {
        SERVICES.clear();
    }

    /**
     * Summary metrics for a single external service.
     */
    public static final class ServiceSnapshot {
        public final long callsLastHour;
        public final long failuresLastHour;
        public final double failurePct;
        public final double avgLatencyMs;
        public final String status;

        private ServiceSnapshot(long callsLastHour, long failuresLastHour, double failurePct, double avgLatencyMs,
                String status) {
            this.callsLastHour = callsLastHour;
            this.failuresLastHour = failuresLastHour;
            this.failurePct = failurePct;
            this.avgLatencyMs = avgLatencyMs;
            this.status = status;
        }
    }

    /**
     * Ring buffer of per-minute counts for one service.
     */
    private static final class ServiceBuckets {
        private final long[] total = new long[WINDOW_MINUTES];
        private final long[] fail = new long[WINDOW_MINUTES];
        private final long[] latencyMs = new long[WINDOW_MINUTES];
        private final long[] minute = new long[WINDOW_MINUTES];

        private synchronized void record(boolean success, long elapsedMs, long nowMin) {
            int idx = (int) (nowMin % WINDOW_MINUTES);
            if (minute[idx] != nowMin) {
                minute[idx] = nowMin;
                total[idx] = 0L;
                fail[idx] = 0L;
                latencyMs[idx] = 0L;
            }
            total[idx] += 1L;
            latencyMs[idx] += elapsedMs;
            if (!success) {
                fail[idx] += 1L;
            }
        }

        private synchronized ServiceSnapshot snapshot(long nowMin) {
            long totalSum = 0L;
            long failSum = 0L;
            long latencySum = 0L;
            for (int i = 0; i < WINDOW_MINUTES; i++) {
                long bucketMin = minute[i];
                if (bucketMin == 0L || (nowMin - bucketMin) >= WINDOW_MINUTES)
                    continue;
                totalSum += total[i];
                failSum += fail[i];
                latencySum += latencyMs[i];
            }
            double failurePct = totalSum == 0 ? 0.0 : (failSum * 100.0) / totalSum;
            double avgLatency = totalSum == 0 ? 0.0 : (double) latencySum / totalSum;
            String status;
            if (totalSum == 0) {
                status = "no-data";
            } else if (failurePct >= 50.0) {
                status = "down";
            } else if (failurePct >= 10.0) {
                status = "degraded";
            } else {
                status = "ok";
            }
            return new ServiceSnapshot(totalSum, failSum, failurePct, avgLatency, status);
        }
    }
}
