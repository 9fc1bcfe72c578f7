package space.ketterling.geoanalysis.guardrail;

import space.ketterling.geoanalysis.config.AppConfig;
import space.ketterling.geoanalysis.plan.AnalysisType;
import space.ketterling.geoanalysis.plan.DataProduct;
import space.ketterling.geoanalysis.plan.DatasetId;

import java.util.*;
import java.util.function.Function;

/**
 * Read-only limits applied to every plan before any remote work is done.
 */
public record GuardrailPolicy(
        double maxTimeRangeYears,
        double maxAoiDegrees,
        Set<AnalysisType> allowedAnalysisTypes,
        Set<DataProduct> allowedDataProducts,
        Set<DatasetId> allowedDatasetIds) {

    public GuardrailPolicy {
        if (!(maxTimeRangeYears > 0))
            throw new IllegalArgumentException("maxTimeRangeYears must be positive");
        if (!(maxAoiDegrees > 0))
            throw new IllegalArgumentException("maxAoiDegrees must be positive");
        allowedAnalysisTypes = Collections.unmodifiableSet(EnumSet.copyOf(nonEmpty(allowedAnalysisTypes,
                "allowedAnalysisTypes")));
        allowedDataProducts = Collections.unmodifiableSet(EnumSet.copyOf(nonEmpty(allowedDataProducts,
                "allowedDataProducts")));
        allowedDatasetIds = Collections.unmodifiableSet(EnumSet.copyOf(nonEmpty(allowedDatasetIds,
                "allowedDatasetIds")));
    }

    /**
     * Builds the policy from configuration. An empty dataset list allows the
     * whole catalog.
     *
     * @throws IllegalStateException when a configured name is unknown
     */
    public static GuardrailPolicy from(AppConfig cfg) {
        Set<AnalysisType> types = parse(cfg.allowedAnalysisTypes(), AnalysisType::fromWire, "guardrail.analysisTypes");
        Set<DataProduct> products = parse(cfg.allowedDataProducts(), DataProduct::fromWire,
                "guardrail.dataProducts");
        Set<DatasetId> datasets = cfg.allowedDatasetIds().isEmpty()
                ? EnumSet.allOf(DatasetId.class)
                : parse(cfg.allowedDatasetIds(), DatasetId::fromCatalogId, "guardrail.datasetIds");
        return new GuardrailPolicy(cfg.maxTimeRangeYears(), cfg.maxAoiDegrees(), types, products, datasets);
    }

    private static <E> Set<E> parse(List<String> names, Function<String, Optional<E>> lookup, String key) {
        Set<E> out = new LinkedHashSet<>();
        for (String n : names) {
            out.add(lookup.apply(n).orElseThrow(
                    () -> new IllegalStateException("Unknown value \"" + n + "\" in " + key)));
        }
        return out;
    }

    private static <E> Set<E> nonEmpty(Set<E> s, String name) {
        if (s == null || s.isEmpty())
            throw new IllegalArgumentException(name + " must not be empty");
        return s;
    }
}
