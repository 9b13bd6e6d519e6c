package dev.bomcompare.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;

import dev.bomcompare.db.IngestLogRepo.IngestRun;
import dev.bomcompare.metrics.ExternalApiMetrics;

/**
 * Routes that show ingest runs and feed health (for debugging the pipeline).
 */
final class ApiRoutesIngest {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesIngest() {
    }

    /**
     * Registers ingest log and external metric endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        app.get("/api/ingest/runs", ctx -> {
            int limit = ApiServer.parseInt(ctx.queryParam("limit"), 50, 1, 200);

            ArrayNode arr = om.createArrayNode();
            for (IngestRun run : api.ingestLog().recentRuns(limit)) {
                ObjectNode row = om.createObjectNode();
                row.put("run_id", run.runId().toString());
                row.put("job_name", run.jobName());
                row.put("started_at", run.startedAt().toString());
                ApiServer.putNullable(row, "finished_at", run.finishedAt());
                row.put("status", run.status());
                ApiServer.putNullable(row, "notes", run.notes());
                arr.add(row);
            }
            ctx.json(arr);
        });

        app.get("/api/metrics/external", ctx -> {
            ObjectNode out = om.createObjectNode();
            out.put("window_minutes", ExternalApiMetrics.windowMinutes());
            ArrayNode services = out.putArray("services");

            for (var e : ExternalApiMetrics.snapshot().entrySet()) {
                var snap = e.getValue();
                ObjectNode row = om.createObjectNode();
                row.put("service", e.getKey());
                row.put("calls", snap.calls());
                row.put("failures", snap.failures());
                row.put("failure_pct", snap.failurePct());
                row.put("status", snap.status());
                services.add(row);
            }
            ctx.json(out);
        });
    }
}
