package space.ketterling.geoanalysis.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import space.ketterling.geoanalysis.geo.BoundingBox;
import space.ketterling.geoanalysis.stats.SeriesStatistics;
import space.ketterling.geoanalysis.workflow.Attribution;
import space.ketterling.geoanalysis.workflow.TimeSeriesPoint;

import java.util.List;
import java.util.Map;

/**
 * Finished analysis as returned to callers and stored in the cache.
 *
 * <p>
 * {@code mapTileUrl}, {@code timeSeries}, {@code statistics} and
 * {@code changePercent} are null when the workflow did not produce them.
 * </p>
 */
public record AnalysisArtifact(
        String mapTileUrl,
        BoundingBox mapBounds,
        List<TimeSeriesPoint> timeSeries,
        SeriesStatistics statistics,
        Double changePercent,
        Map<String, Object> diagnostics,
        List<Attribution> attributions,
        Metadata metadata) {

    public AnalysisArtifact {
        timeSeries = timeSeries == null ? null : List.copyOf(timeSeries);
        diagnostics = diagnostics == null ? Map.of() : diagnostics;
        attributions = List.copyOf(attributions);
    }

    /**
     * Run details. {@code location} is the name or bbox label from the plan.
     */
    public record Metadata(
            String analysisType,
            String location,
            String start,
            String end,
            long computeTimeMs,
            boolean cached,
            List<String> warnings,
            String cacheKey) {

        public Metadata {
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }
    }

    /**
     * Same artifact flagged as served from the cache.
     */
    public AnalysisArtifact asCached() {
        Metadata m = metadata;
        return new AnalysisArtifact(mapTileUrl, mapBounds, timeSeries, statistics, changePercent, diagnostics,
                attributions, new Metadata(m.analysisType(), m.location(), m.start(), m.end(), m.computeTimeMs(), true,
                        m.warnings(), m.cacheKey()));
    }

    public ObjectNode toJson(ObjectMapper om) {
        ObjectNode out = om.createObjectNode();
        if (mapTileUrl != null)
            out.put("mapTileUrl", mapTileUrl);
        if (mapBounds != null) {
            ArrayNode b = out.putArray("mapBounds");
            for (double v : mapBounds.toArray())
                b.add(v);
        }
        if (timeSeries != null) {
            ArrayNode ts = out.putArray("timeSeries");
            for (TimeSeriesPoint p : timeSeries) {
                ObjectNode n = ts.addObject();
                n.put("date", p.date());
                n.put("value", p.value());
                if (p.label() != null)
                    n.put("label", p.label());
            }
        }
        if (statistics != null || changePercent != null) {
            ObjectNode s = out.putObject("stats");
            if (statistics != null) {
                s.put("mean", statistics.mean());
                s.put("min", statistics.min());
                s.put("minDate", statistics.minDate());
                s.put("max", statistics.max());
                s.put("maxDate", statistics.maxDate());
                s.put("stdDev", statistics.stdDev());
                s.put("trend", statistics.trend());
            }
            if (changePercent != null)
                s.put("changePercent", changePercent);
        }
        if (!diagnostics.isEmpty())
            out.set("diagnostics", om.valueToTree(diagnostics));

        ArrayNode attrs = out.putArray("attributions");
        for (Attribution a : attributions) {
            ObjectNode n = attrs.addObject();
            n.put("dataset", a.dataset());
            n.put("source", a.source());
            if (a.license() != null)
                n.put("license", a.license());
            if (a.citation() != null)
                n.put("citation", a.citation());
            if (a.dateRange() != null)
                n.put("dateRange", a.dateRange());
        }

        ObjectNode md = out.putObject("metadata");
        md.put("analysisType", metadata.analysisType());
        md.put("location", metadata.location());
        ObjectNode tr = md.putObject("timeRange");
        tr.put("start", metadata.start());
        tr.put("end", metadata.end());
        md.put("computeTimeMs", metadata.computeTimeMs());
        md.put("cached", metadata.cached());
        ArrayNode w = md.putArray("warnings");
        metadata.warnings().forEach(w::add);
        md.put("cacheKey", metadata.cacheKey());
        return out;
    }
}
