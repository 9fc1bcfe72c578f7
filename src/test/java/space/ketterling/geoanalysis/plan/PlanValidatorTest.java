package space.ketterling.geoanalysis.plan;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import space.ketterling.geoanalysis.geo.BoundingBox;
import space.ketterling.geoanalysis.plan.PlanValidationException.FieldError;
import space.ketterling.geoanalysis.testing.TestPlans;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("PlanValidator Tests")
class PlanValidatorTest {

    private final ObjectMapper om = new ObjectMapper();
    private final PlanValidator validator = new PlanValidator(om);

    private static Map<String, String> byField(PlanValidationException e) {
        return e.fieldErrors().stream()
                .collect(Collectors.toMap(FieldError::field, FieldError::message, (a, b) -> a + " | " + b));
    }

    @Test
    @DisplayName("Valid plan yields a typed plan")
    void testValidPlan() {
        AnalysisPlan plan = validator.validate(TestPlans.rawVegetationPlan(om));

        assertEquals(AnalysisType.TIMESERIES, plan.analysisType());
        assertEquals(DataProduct.VEGETATION, plan.dataProduct());
        assertEquals(List.of(DatasetId.SENTINEL2_SR), plan.datasetIds());
        assertEquals(TimeRange.of("2024-01-01", "2024-06-30"), plan.timeRange());
        assertEquals("Tokyo", plan.location().name().orElseThrow());
        assertEquals(List.of(OutputKind.MAP, OutputKind.TIMESERIES), List.copyOf(plan.outputs()));
        assertEquals(AnalysisParameters.NONE, plan.parameters());
    }

    @Test
    @DisplayName("JSON text is parsed before validation")
    void testValidateString() {
        AnalysisPlan plan = validator.validate(TestPlans.rawVegetationPlan(om).toString());
        assertEquals(DataProduct.VEGETATION, plan.dataProduct());

        PlanValidationException e = assertThrows(PlanValidationException.class, () -> validator.validate("{oops"));
        assertEquals("$", e.fieldErrors().get(0).field());
    }

    @Test
    @DisplayName("Non-object input is rejected as a whole")
    void testNonObject() {
        PlanValidationException e = assertThrows(PlanValidationException.class,
                () -> validator.validate(om.createArrayNode()));
        assertEquals(1, e.fieldErrors().size());
        assertEquals("$", e.fieldErrors().get(0).field());
        assertEquals("validation_error", e.errorCode());
    }

    @Test
    @DisplayName("Every missing field is reported at once")
    void testAllMissingFields() {
        PlanValidationException e = assertThrows(PlanValidationException.class,
                () -> validator.validate(om.createObjectNode()));
        Map<String, String> errors = byField(e);

        for (String f : List.of("analysisType", "dataProduct", "datasetIds", "timeRange", "location", "outputs")) {
            assertEquals("is required", errors.get(f), f);
        }
    }

    @Test
    @DisplayName("Enum values are matched exactly and never coerced")
    void testUnknownEnums() {
        ObjectNode raw = TestPlans.rawVegetationPlan(om);
        raw.put("analysisType", "TimeSeries");
        raw.putArray("datasetIds").add("COPERNICUS/S2_SR").add("NASA/NOPE");

        Map<String, String> errors = byField(assertThrows(PlanValidationException.class,
                () -> validator.validate(raw)));

        assertTrue(errors.get("analysisType").startsWith("unknown value \"TimeSeries\""));
        assertTrue(errors.get("analysisType").contains("timeseries"));
        assertTrue(errors.get("datasetIds[1]").contains("\"NASA/NOPE\""));
        assertFalse(errors.containsKey("datasetIds[0]"));
    }

    @Test
    @DisplayName("Empty arrays get dedicated messages")
    void testEmptyArrays() {
        ObjectNode raw = TestPlans.rawVegetationPlan(om);
        raw.putArray("datasetIds");
        raw.putArray("outputs");

        Map<String, String> errors = byField(assertThrows(PlanValidationException.class,
                () -> validator.validate(raw)));

        assertEquals("At least one datasetId is required", errors.get("datasetIds"));
        assertEquals("At least one output type is required", errors.get("outputs"));
    }

    @Test
    @DisplayName("Dates must be real ISO calendar dates with start before end")
    void testDates() {
        ObjectNode raw = TestPlans.rawVegetationPlan(om);
        ObjectNode tr = raw.putObject("timeRange");
        tr.put("start", "2024/01/01");
        tr.put("end", "2024-02-30");
        Map<String, String> errors = byField(assertThrows(PlanValidationException.class,
                () -> validator.validate(raw)));
        assertEquals("Date must be in YYYY-MM-DD format", errors.get("timeRange.start"));
        assertTrue(errors.get("timeRange.end").startsWith("not a real calendar date"));

        tr.put("start", "2024-03-01");
        tr.put("end", "2024-03-01");
        errors = byField(assertThrows(PlanValidationException.class, () -> validator.validate(raw)));
        assertEquals("start must be before end", errors.get("timeRange"));
    }

    @Test
    @DisplayName("Location accepts a trimmed name or a valid bbox")
    void testLocationForms() {
        ObjectNode raw = TestPlans.rawVegetationPlan(om);
        raw.put("location", "  Kyoto ");
        assertEquals("Kyoto", validator.validate(raw).location().name().orElseThrow());

        raw.putArray("location").add(139.5).add(35.5).add(139.9).add(35.8);
        assertEquals(new BoundingBox(139.5, 35.5, 139.9, 35.8),
                validator.validate(raw).location().bbox().orElseThrow());
    }

    @Test
    @DisplayName("Bad locations report each problem")
    void testBadLocations() {
        ObjectNode raw = TestPlans.rawVegetationPlan(om);
        raw.put("location", "   ");
        assertEquals("Location name cannot be empty",
                byField(assertThrows(PlanValidationException.class, () -> validator.validate(raw))).get("location"));

        raw.putArray("location").add(1).add(2).add(3);
        assertTrue(byField(assertThrows(PlanValidationException.class, () -> validator.validate(raw)))
                .get("location").startsWith("bbox must have exactly 4 values"));

        raw.putArray("location").add(1).add("two").add(3).add(4);
        assertEquals("must be a number",
                byField(assertThrows(PlanValidationException.class, () -> validator.validate(raw))).get("location[1]"));

        raw.putArray("location").add(10).add(0).add(5).add(95);
        PlanValidationException e = assertThrows(PlanValidationException.class, () -> validator.validate(raw));
        List<String> messages = e.fieldErrors().stream().map(FieldError::message).collect(Collectors.toList());
        assertTrue(messages.contains("Latitude must be between -90 and 90."));
        assertTrue(messages.contains("West longitude must be less than east longitude."));
    }

    @Test
    @DisplayName("Parameters are typed and unknown keys rejected")
    void testParameters() {
        ObjectNode raw = TestPlans.rawVegetationPlan(om);
        ObjectNode params = raw.putObject("parameters");
        params.put("index", "ndwi");
        params.put("reducer", "median");
        params.put("scaleMeters", 250);
        params.put("maxCloudPercent", 35.5);

        AnalysisParameters p = validator.validate(raw).parameters();
        assertEquals(SpectralIndex.NDWI, p.indexOpt().orElseThrow());
        assertEquals(Reducer.MEDIAN, p.reducerOpt().orElseThrow());
        assertEquals(250, p.scaleMetersOpt().orElseThrow().intValue());
        assertEquals(35.5, p.maxCloudPercentOpt().orElseThrow().doubleValue());

        params.put("scaleMeters", -1);
        params.put("maxCloudPercent", 101);
        params.put("colour", "red");
        Map<String, String> errors = byField(assertThrows(PlanValidationException.class,
                () -> validator.validate(raw)));
        assertEquals("must be a positive integer", errors.get("parameters.scaleMeters"));
        assertTrue(errors.containsKey("parameters.maxCloudPercent"));
        assertEquals("unknown parameter", errors.get("parameters.colour"));
    }
}
