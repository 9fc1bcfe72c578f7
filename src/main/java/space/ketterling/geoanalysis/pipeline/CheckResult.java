package space.ketterling.geoanalysis.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import space.ketterling.geoanalysis.guardrail.GuardrailResult;
import space.ketterling.geoanalysis.plan.AnalysisPlan;
import space.ketterling.geoanalysis.plan.DatasetId;
import space.ketterling.geoanalysis.plan.OutputKind;

/**
 * Dry-run outcome: the typed plan, its cache key, and the guardrail verdict.
 */
public record CheckResult(AnalysisPlan plan, String cacheKey, GuardrailResult guardrails, boolean cached) {

    public ObjectNode toJson(ObjectMapper om) {
        ObjectNode out = om.createObjectNode();
        out.put("valid", guardrails.valid());
        if (guardrails.error() != null)
            out.put("error", guardrails.error());
        ArrayNode w = out.putArray("warnings");
        guardrails.warnings().forEach(w::add);
        out.put("cacheKey", cacheKey);
        out.put("cached", cached);

        ObjectNode p = out.putObject("plan");
        p.put("analysisType", plan.analysisType().wireName());
        p.put("dataProduct", plan.dataProduct().wireName());
        ArrayNode ds = p.putArray("datasetIds");
        plan.datasetIds().stream().map(DatasetId::catalogId).forEach(ds::add);
        ObjectNode tr = p.putObject("timeRange");
        tr.put("start", plan.timeRange().start().toString());
        tr.put("end", plan.timeRange().end().toString());
        if (plan.location().isNamed()) {
            p.put("location", plan.location().label());
        } else {
            ArrayNode loc = p.putArray("location");
            for (double v : plan.location().bbox().orElseThrow().toArray())
                loc.add(v);
        }
        ArrayNode outputs = p.putArray("outputs");
        plan.outputs().stream().map(OutputKind::wireName).forEach(outputs::add);
        return out;
    }
}
