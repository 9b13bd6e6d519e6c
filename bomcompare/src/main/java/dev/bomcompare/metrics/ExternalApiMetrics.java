package dev.bomcompare.metrics;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts successful and failed calls to the BoM feed over a rolling hour.
 */
public final class ExternalApiMetrics {
    private static final int WINDOW_MINUTES = 60;
    private static final Map<String, MinuteRing> SERVICES = new ConcurrentHashMap<>();

    private ExternalApiMetrics() {
    }

    /**
     * Records one call outcome for a named external service.
     */
    public static void record(String service, boolean success) {
        if (service == null || service.isBlank())
            return;
        SERVICES.computeIfAbsent(service, k -> new MinuteRing()).record(System.currentTimeMillis() / 60000L, success);
    }

    /**
     * Health of every service seen so far, sorted by name.
     */
    public static Map<String, ServiceSnapshot> snapshot() {
        long nowMin = System.currentTimeMillis() / 60000L;
        Map<String, ServiceSnapshot> out = new TreeMap<>();
        SERVICES.forEach((name, ring) -> out.put(name, ring.snapshot(nowMin)));
        return out;
    }

    public static int windowMinutes() {
        return WINDOW_MINUTES;
    }

    /**
     * Forgets all recorded calls.
     */
    public static void reset() {
        SERVICES.clear();
    }

    /**
     * Call counts for one service; status is no-data, ok, degraded (>=10% failed) or down (>=50%).
     */
    public record ServiceSnapshot(long calls, long failures, double failurePct, String status) {
    }

    private static final class MinuteRing {
        private final long[] minute = new long[WINDOW_MINUTES];
        private final long[] calls = new long[WINDOW_MINUTES];
        private final long[] failures = new long[WINDOW_MINUTES];

        synchronized void record(long nowMin, boolean success) {
            int idx = (int) (nowMin % WINDOW_MINUTES);
            if (minute[idx] != nowMin) {
                minute[idx] = nowMin;
                calls[idx] = 0L;
                failures[idx] = 0L;
            }
            calls[idx]++;
            if (!success)
                failures[idx]++;
        }

        synchronized ServiceSnapshot snapshot(long nowMin) {
            long total = 0L;
            long failed = 0L;
            for (int i = 0; i < WINDOW_MINUTES; i++) {
                if (minute[i] == 0L || nowMin - minute[i] >= WINDOW_MINUTES)
                    continue;
                total += calls[i];
                failed += failures[i];
            }
            double pct = total == 0 ? 0.0 : (failed * 100.0) / total;
            String status;
            if (total == 0)
                status = "no-data";
            else if (pct >= 50.0)
                status = "down";
            else if (pct >= 10.0)
                status = "degraded";
            else
                status = "ok";
            return new ServiceSnapshot(total, failed, pct, status);
        }
    }
}
