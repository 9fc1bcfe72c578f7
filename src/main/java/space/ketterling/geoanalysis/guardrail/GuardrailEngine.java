package space.ketterling.geoanalysis.guardrail;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.geoanalysis.geo.BoundingBox;
import space.ketterling.geoanalysis.plan.AnalysisPlan;
import space.ketterling.geoanalysis.plan.DatasetId;
import space.ketterling.geoanalysis.plan.TimeRange;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Checks a validated plan against the {@link GuardrailPolicy}.
 *
 * <p>
 * The time range, analysis type, dataset and area checks are independent and
 * always all run. Each failing check contributes one message; messages are
 * joined with a single space.
 * </p>
 */
public final class GuardrailEngine {
    private static final Logger log = LoggerFactory.getLogger(GuardrailEngine.class);
    private static final double DAYS_PER_YEAR = 365.2425;

    private final GuardrailPolicy policy;
    private final Clock clock;

    public GuardrailEngine(GuardrailPolicy policy, Clock clock) {
        this.policy = policy;
        this.clock = clock;
    }

    public GuardrailPolicy policy() {
        return policy;
    }

    public GuardrailResult evaluate(AnalysisPlan plan) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        String timeError = checkTimeRange(plan, warnings);
        if (timeError != null)
            errors.add(timeError);
        String typeError = checkAnalysisType(plan);
        if (typeError != null)
            errors.add(typeError);
        String datasetError = checkDatasets(plan);
        if (datasetError != null)
            errors.add(datasetError);
        String aoiError = checkArea(plan);
        if (aoiError != null)
            errors.add(aoiError);

        GuardrailResult result = errors.isEmpty()
                ? new GuardrailResult(true, null, warnings)
                : new GuardrailResult(false, String.join(" ", errors), warnings);

        log.info("Analysis request type={} product={} datasets={} range={} location={} valid={} warnings={}",
                plan.analysisType().wireName(), plan.dataProduct().wireName(),
                plan.datasetIds().stream().map(DatasetId::catalogId).collect(Collectors.toList()),
                plan.timeRange(), locationForLog(plan), result.valid(), result.warnings().size());
        return result;
    }

    /**
     * Evaluates and throws when the plan is rejected.
     *
     * @return the (valid) result, possibly carrying warnings
     */
    public GuardrailResult enforce(AnalysisPlan plan) {
        GuardrailResult r = evaluate(plan);
        if (!r.valid()) {
            throw new GuardrailViolationException(r.error(), r.warnings());
        }
        return r;
    }

    private String checkTimeRange(AnalysisPlan plan, List<String> warnings) {
        TimeRange range = plan.timeRange();
        if (!range.start().isBefore(range.end())) {
            return "Start date must be before end date.";
        }
        double years = range.days() / DAYS_PER_YEAR;
        if (years > policy.maxTimeRangeYears()) {
            return String.format(Locale.ROOT, "Time range too large. Maximum allowed: %s years. Your request: %.3f years.",
                    trim(policy.maxTimeRangeYears()), years);
        }
        LocalDate today = LocalDate.now(clock);
        if (range.end().isAfter(today)) {
            return "End date cannot be in the future.";
        }
        LocalDate floor = plan.dataProduct().availableFrom();
        if (range.start().isBefore(floor)) {
            warnings.add("Start date is before " + floor + ". " + plan.dataProduct().wireName()
                    + " datasets may have limited availability for this period.");
        }
        return null;
    }

    private String checkAnalysisType(AnalysisPlan plan) {
        if (policy.allowedAnalysisTypes().contains(plan.analysisType()))
            return null;
        return "Unsupported analysis type: \"" + plan.analysisType().wireName() + "\". Supported types: "
                + policy.allowedAnalysisTypes().stream().map(t -> t.wireName()).collect(Collectors.joining(", "));
    }

    private String checkDatasets(AnalysisPlan plan) {
        List<String> problems = new ArrayList<>();
        if (!policy.allowedDataProducts().contains(plan.dataProduct())) {
            problems.add("Unsupported data product: \"" + plan.dataProduct().wireName() + "\". Supported products: "
                    + policy.allowedDataProducts().stream().map(p -> p.wireName()).collect(Collectors.joining(", "))
                    + ".");
        }
        List<String> unsupported = plan.datasetIds().stream()
                .filter(d -> !policy.allowedDatasetIds().contains(d))
                .map(DatasetId::catalogId)
                .collect(Collectors.toList());
        if (!unsupported.isEmpty()) {
            problems.add("Unsupported datasets: " + String.join(", ", unsupported) + ". Supported datasets: "
                    + policy.allowedDatasetIds().stream().map(DatasetId::catalogId).collect(Collectors.joining(", "))
                    + ".");
        }
        return problems.isEmpty() ? null : String.join(" ", problems);
    }

    private String checkArea(AnalysisPlan plan) {
        // named places are sized by the resolver
        BoundingBox box = plan.location().bbox().orElse(null);
        if (box == null)
            return null;
        List<String> problems = box.problems();
        if (!problems.isEmpty())
            return problems.get(0);
        double max = policy.maxAoiDegrees();
        if (box.widthDegrees() > max || box.heightDegrees() > max) {
            return String.format(Locale.ROOT,
                    "Area of interest too large. Maximum: %s° x %s°. Your request: %.2f° x %.2f°.",
                    trim(max), trim(max), box.widthDegrees(), box.heightDegrees());
        }
        return null;
    }

    private static String locationForLog(AnalysisPlan plan) {
        return plan.location().isNamed() ? plan.location().label() : "bbox:" + plan.location().label();
    }

    private static String trim(double v) {
        return v == Math.rint(v) ? Long.toString((long) v) : Double.toString(v);
    }
}
