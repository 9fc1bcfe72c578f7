package space.ketterling.geoanalysis.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import space.ketterling.geoanalysis.geo.BoundingBox;
import space.ketterling.geoanalysis.geo.Location;
import space.ketterling.geoanalysis.plan.PlanValidationException.FieldError;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns an untyped plan tree into an {@link AnalysisPlan}.
 *
 * <p>
 * Every field is checked even after an earlier one fails, so the resulting
 * {@link PlanValidationException} names all offending fields. Enum values are
 * matched exactly; nothing is coerced.
 * </p>
 */
public final class PlanValidator {
    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Set<String> PARAMETER_KEYS = Set.of("index", "band", "reducer", "scaleMeters",
            "maxCloudPercent");

    private final ObjectMapper om;

    public PlanValidator(ObjectMapper om) {
        this.om = Objects.requireNonNull(om, "om");
    }

    /**
     * Parses JSON text, then validates it.
     */
    public AnalysisPlan validate(String json) {
        JsonNode root;
        try {
            root = om.readTree(json);
        } catch (JsonProcessingException e) {
            throw PlanValidationException.of("$", "plan is not valid JSON: " + e.getOriginalMessage());
        }
        return validate(root);
    }

    /**
     * Validates a raw plan tree.
     *
     * @throws PlanValidationException listing every rejected field
     */
    public AnalysisPlan validate(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw PlanValidationException.of("$", "plan must be a JSON object");
        }
        List<FieldError> errors = new ArrayList<>();

        AnalysisType analysisType = enumField(root, "analysisType", AnalysisType::fromWire,
                AnalysisType.values(), AnalysisType::wireName, errors);
        DataProduct dataProduct = enumField(root, "dataProduct", DataProduct::fromWire,
                DataProduct.values(), DataProduct::wireName, errors);
        List<DatasetId> datasetIds = enumArray(root, "datasetIds", DatasetId::fromCatalogId,
                DatasetId.values(), DatasetId::catalogId, "At least one datasetId is required", errors);
        TimeRange timeRange = timeRange(root.get("timeRange"), errors);
        Location location = location(root.get("location"), errors);
        List<OutputKind> outputs = enumArray(root, "outputs", OutputKind::fromWire,
                OutputKind.values(), OutputKind::wireName, "At least one output type is required", errors);
        AnalysisParameters parameters = parameters(root.get("parameters"), errors);

        if (!errors.isEmpty()) {
            throw new PlanValidationException(errors);
        }
        return new AnalysisPlan(analysisType, dataProduct, datasetIds, timeRange, location,
                new LinkedHashSet<>(outputs), parameters);
    }

    private static <E> E enumField(JsonNode root, String field, Function<String, Optional<E>> lookup,
            E[] allowed, Function<E, String> wire, List<FieldError> errors) {
        JsonNode n = root.get(field);
        if (n == null || n.isNull()) {
            errors.add(new FieldError(field, "is required"));
            return null;
        }
        if (!n.isTextual()) {
            errors.add(new FieldError(field, "must be a string"));
            return null;
        }
        Optional<E> v = lookup.apply(n.asText());
        if (v.isEmpty()) {
            errors.add(new FieldError(field, "unknown value \"" + n.asText() + "\"; expected one of "
                    + joinAllowed(allowed, wire)));
            return null;
        }
        return v.get();
    }

    private static <E> List<E> enumArray(JsonNode root, String field, Function<String, Optional<E>> lookup,
            E[] allowed, Function<E, String> wire, String emptyMessage, List<FieldError> errors) {
        JsonNode n = root.get(field);
        if (n == null || n.isNull()) {
            errors.add(new FieldError(field, "is required"));
            return List.of();
        }
        if (!n.isArray()) {
            errors.add(new FieldError(field, "must be an array"));
            return List.of();
        }
        if (n.size() == 0) {
            errors.add(new FieldError(field, emptyMessage));
            return List.of();
        }
        List<E> out = new ArrayList<>();
        for (int i = 0; i < n.size(); i++) {
            JsonNode item = n.get(i);
            String path = field + "[" + i + "]";
            if (!item.isTextual()) {
                errors.add(new FieldError(path, "must be a string"));
                continue;
            }
            Optional<E> v = lookup.apply(item.asText());
            if (v.isEmpty()) {
                errors.add(new FieldError(path, "unknown value \"" + item.asText() + "\"; expected one of "
                        + joinAllowed(allowed, wire)));
                continue;
            }
            out.add(v.get());
        }
        return out;
    }

    private static TimeRange timeRange(JsonNode n, List<FieldError> errors) {
        if (n == null || n.isNull()) {
            errors.add(new FieldError("timeRange", "is required"));
            return null;
        }
        if (!n.isObject()) {
            errors.add(new FieldError("timeRange", "must be an object with start and end"));
            return null;
        }
        LocalDate start = date(n.get("start"), "timeRange.start", errors);
        LocalDate end = date(n.get("end"), "timeRange.end", errors);
        if (start == null || end == null)
            return null;
        if (!start.isBefore(end)) {
            errors.add(new FieldError("timeRange", "start must be before end"));
            return null;
        }
        return new TimeRange(start, end);
    }

    private static LocalDate date(JsonNode n, String path, List<FieldError> errors) {
        if (n == null || n.isNull()) {
            errors.add(new FieldError(path, "is required"));
            return null;
        }
        if (!n.isTextual() || !ISO_DATE.matcher(n.asText()).matches()) {
            errors.add(new FieldError(path, "Date must be in YYYY-MM-DD format"));
            return null;
        }
        try {
            return LocalDate.parse(n.asText());
        } catch (DateTimeParseException e) {
            errors.add(new FieldError(path, "not a real calendar date: " + n.asText()));
            return null;
        }
    }

    private static Location location(JsonNode n, List<FieldError> errors) {
        if (n == null || n.isNull()) {
            errors.add(new FieldError("location", "is required"));
            return null;
        }
        if (n.isTextual()) {
            if (n.asText().isBlank()) {
                errors.add(new FieldError("location", "Location name cannot be empty"));
                return null;
            }
            return Location.named(n.asText().trim());
        }
        if (n.isArray()) {
            if (n.size() != 4) {
                errors.add(new FieldError("location", "bbox must have exactly 4 values [west, south, east, north]"));
                return null;
            }
            double[] v = new double[4];
            boolean numeric = true;
            for (int i = 0; i < 4; i++) {
                if (!n.get(i).isNumber()) {
                    errors.add(new FieldError("location[" + i + "]", "must be a number"));
                    numeric = false;
                } else {
                    v[i] = n.get(i).asDouble();
                }
            }
            if (!numeric)
                return null;
            BoundingBox box = BoundingBox.of(v);
            List<String> problems = box.problems();
            if (!problems.isEmpty()) {
                for (String p : problems)
                    errors.add(new FieldError("location", p));
                return null;
            }
            return Location.box(box);
        }
        errors.add(new FieldError("location", "must be a place name or [west, south, east, north]"));
        return null;
    }

    private static AnalysisParameters parameters(JsonNode n, List<FieldError> errors) {
        if (n == null || n.isNull())
            return AnalysisParameters.NONE;
        if (!n.isObject()) {
            errors.add(new FieldError("parameters", "must be an object"));
            return AnalysisParameters.NONE;
        }
        Iterator<String> names = n.fieldNames();
        while (names.hasNext()) {
            String key = names.next();
            if (!PARAMETER_KEYS.contains(key))
                errors.add(new FieldError("parameters." + key, "unknown parameter"));
        }

        SpectralIndex index = null;
        JsonNode idx = n.get("index");
        if (idx != null && !idx.isNull()) {
            index = idx.isTextual() ? SpectralIndex.fromWire(idx.asText()).orElse(null) : null;
            if (index == null)
                errors.add(new FieldError("parameters.index", "expected one of "
                        + joinAllowed(SpectralIndex.values(), SpectralIndex::wireName)));
        }

        String band = null;
        JsonNode b = n.get("band");
        if (b != null && !b.isNull()) {
            if (!b.isTextual() || b.asText().isBlank())
                errors.add(new FieldError("parameters.band", "must be a non-empty string"));
            else
                band = b.asText();
        }

        Reducer reducer = null;
        JsonNode r = n.get("reducer");
        if (r != null && !r.isNull()) {
            reducer = r.isTextual() ? Reducer.fromWire(r.asText()).orElse(null) : null;
            if (reducer == null)
                errors.add(new FieldError("parameters.reducer", "expected one of "
                        + joinAllowed(Reducer.values(), Reducer::wireName)));
        }

        Integer scale = null;
        JsonNode s = n.get("scaleMeters");
        if (s != null && !s.isNull()) {
            if (!s.isIntegralNumber() || s.asLong() <= 0 || s.asLong() > Integer.MAX_VALUE)
                errors.add(new FieldError("parameters.scaleMeters", "must be a positive integer"));
            else
                scale = s.asInt();
        }

        Double cloud = null;
        JsonNode c = n.get("maxCloudPercent");
        if (c != null && !c.isNull()) {
            if (!c.isNumber() || c.asDouble() < 0 || c.asDouble() > 100)
                errors.add(new FieldError("parameters.maxCloudPercent", "must be a number between 0 and 100"));
            else
                cloud = c.asDouble();
        }

        return new AnalysisParameters(index, band, reducer, scale, cloud);
    }

    private static <E> String joinAllowed(E[] values, Function<E, String> wire) {
        return Arrays.stream(values).map(wire).collect(Collectors.joining(", "));
    }
}
