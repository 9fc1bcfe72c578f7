package space.ketterling.geoanalysis.workflow;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import space.ketterling.geoanalysis.plan.DataProduct;
import space.ketterling.geoanalysis.testing.FakeComputeEngine;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("WorkflowRouter Tests")
class WorkflowRouterTest {

    private final FakeComputeEngine engine = FakeComputeEngine.constant(1.0);
    // routing never executes, so no pool
    private final TimeSeriesExecutor ts = new TimeSeriesExecutor(engine, null, Duration.ofSeconds(1),
            Duration.ofSeconds(1));
    private final ChangeDetectionExecutor change = new ChangeDetectionExecutor(engine);

    @Test
    @DisplayName("Standard router covers the five implemented products")
    void testStandard() {
        WorkflowRouter router = WorkflowRouter.standard(ts, change);
        assertEquals(List.of("vegetation", "water", "temperature", "precipitation", "air_quality"),
                router.supportedProducts());
        for (String name : router.supportedProducts()) {
            DataProduct p = DataProduct.fromWire(name).orElseThrow();
            assertEquals(p, router.resolve(p).dataProduct());
        }
        assertThrows(UnsupportedWorkflowException.class, () -> router.resolve(DataProduct.URBAN));
    }

    @Test
    @DisplayName("Unregistered product lists what is supported")
    void testUnsupported() {
        WorkflowRouter router = new WorkflowRouter(List.of(new VegetationWorkflow(ts, change)));
        UnsupportedWorkflowException e = assertThrows(UnsupportedWorkflowException.class,
                () -> router.resolve(DataProduct.WATER));
        assertEquals(List.of("vegetation"), e.supported());
        assertTrue(e.getMessage().contains("dataProduct=\"water\""), e.getMessage());
        assertEquals("unsupported_workflow", e.errorCode());
    }

    @Test
    @DisplayName("Two workflows for one product are rejected")
    void testDuplicate() {
        assertThrows(IllegalArgumentException.class, () -> new WorkflowRouter(List.of(
                new VegetationWorkflow(ts, change), new VegetationWorkflow(ts, change))));
    }
}
