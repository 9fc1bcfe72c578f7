package space.ketterling.geoanalysis.guardrail;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import space.ketterling.geoanalysis.geo.BoundingBox;
import space.ketterling.geoanalysis.geo.Location;
import space.ketterling.geoanalysis.plan.*;
import space.ketterling.geoanalysis.testing.TestPlans;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("GuardrailEngine Tests")
class GuardrailEngineTest {

    private static GuardrailPolicy openPolicy() {
        return new GuardrailPolicy(5, 10, EnumSet.allOf(AnalysisType.class), EnumSet.allOf(DataProduct.class),
                EnumSet.allOf(DatasetId.class));
    }

    private final GuardrailEngine engine = new GuardrailEngine(openPolicy(), TestPlans.FIXED_CLOCK);

    @Test
    @DisplayName("A modest plan passes without warnings")
    void testValid() {
        GuardrailResult r = engine.evaluate(TestPlans.temperatureSeries("2024-01-01", "2024-06-30"));
        assertTrue(r.valid());
        assertNull(r.error());
        assertTrue(r.warnings().isEmpty());
    }

    @Test
    @DisplayName("Exactly five years is allowed; one more day is not")
    void testTimeRangeBoundary() {
        assertTrue(engine.evaluate(TestPlans.temperatureSeries("2019-01-01", "2024-01-01")).valid());

        GuardrailResult r = engine.evaluate(TestPlans.temperatureSeries("2019-01-01", "2024-01-02"));
        assertFalse(r.valid());
        assertEquals("Time range too large. Maximum allowed: 5 years. Your request: 5.002 years.", r.error());
    }

    @Test
    @DisplayName("Five calendar years spanning two leap days report the overshoot")
    void testTimeRangeTwoLeapDays() {
        GuardrailResult r = engine.evaluate(TestPlans.temperatureSeries("2016-01-01", "2021-01-01"));
        assertFalse(r.valid());
        assertEquals("Time range too large. Maximum allowed: 5 years. Your request: 5.002 years.", r.error());
    }

    @Test
    @DisplayName("End date after today is rejected")
    void testFutureEnd() {
        GuardrailResult r = engine.evaluate(TestPlans.temperatureSeries("2024-06-01", "2025-01-02"));
        assertEquals("End date cannot be in the future.", r.error());
        assertTrue(engine.evaluate(TestPlans.temperatureSeries("2024-06-01", "2025-01-01")).valid());
    }

    @Test
    @DisplayName("Start before the product's availability only warns")
    void testAvailabilityWarning() {
        AnalysisPlan plan = TestPlans.plan(AnalysisType.TIMESERIES, DataProduct.VEGETATION, "2015-01-01",
                "2015-12-31", Location.named("Tokyo"), DatasetId.SENTINEL2_SR);
        GuardrailResult r = engine.enforce(plan);
        assertTrue(r.valid());
        assertEquals(List.of("Start date is before 2015-06-23. vegetation datasets may have limited availability "
                + "for this period."), r.warnings());
    }

    @Test
    @DisplayName("Oversized bbox is reported with its dimensions")
    void testAreaTooLarge() {
        AnalysisPlan plan = TestPlans.plan(AnalysisType.TIMESERIES, DataProduct.TEMPERATURE, "2024-01-01",
                "2024-02-01", Location.box(new BoundingBox(0, 0, 12.5, 5)), DatasetId.ERA5_DAILY);
        assertEquals("Area of interest too large. Maximum: 10° x 10°. Your request: 12.50° x 5.00°.",
                engine.evaluate(plan).error());
    }

    @Test
    @DisplayName("Every failing check contributes to one message")
    void testAllFailuresCombined() {
        GuardrailPolicy strict = new GuardrailPolicy(5, 10, EnumSet.of(AnalysisType.TIMESERIES),
                EnumSet.of(DataProduct.VEGETATION), EnumSet.of(DatasetId.SENTINEL2_SR));
        GuardrailEngine g = new GuardrailEngine(strict, TestPlans.FIXED_CLOCK);
        AnalysisPlan plan = TestPlans.plan(AnalysisType.CHANGE, DataProduct.TEMPERATURE, "2010-01-01",
                "2020-01-01", Location.box(new BoundingBox(0, 0, 20, 20)), DatasetId.ERA5_DAILY);

        GuardrailViolationException e = assertThrows(GuardrailViolationException.class, () -> g.enforce(plan));
        String msg = e.getMessage();
        assertTrue(msg.startsWith("Time range too large."), msg);
        assertTrue(msg.contains(" Unsupported analysis type: \"change\". Supported types: timeseries"), msg);
        assertTrue(msg.contains(" Unsupported data product: \"temperature\"."), msg);
        assertTrue(msg.contains(" Unsupported datasets: ECMWF/ERA5/DAILY. Supported datasets: COPERNICUS/S2_SR."),
                msg);
        assertTrue(msg.endsWith("Your request: 20.00° x 20.00°."), msg);
        assertEquals("guardrail_violation", e.errorCode());
    }
}
