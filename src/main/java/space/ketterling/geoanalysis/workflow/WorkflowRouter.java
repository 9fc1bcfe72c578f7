package space.ketterling.geoanalysis.workflow;

import space.ketterling.geoanalysis.plan.DataProduct;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Maps a data product to the workflow that handles it.
 *
 * <p>
 * Registrations are fixed at construction. Adding a phenomenon means one new
 * {@link WorkflowExecutor} and one entry in {@link #standard}.
 * </p>
 */
public final class WorkflowRouter {
    private final Map<DataProduct, WorkflowExecutor> workflows = new EnumMap<>(DataProduct.class);

    public WorkflowRouter(Collection<? extends WorkflowExecutor> executors) {
        for (WorkflowExecutor w : executors) {
            WorkflowExecutor prev = workflows.put(w.dataProduct(), w);
            if (prev != null)
                throw new IllegalArgumentException("Two workflows registered for " + w.dataProduct().wireName());
        }
    }

    /**
     * Vegetation, temperature, precipitation, water and air quality.
     */
    public static WorkflowRouter standard(TimeSeriesExecutor timeSeries, ChangeDetectionExecutor change) {
        return new WorkflowRouter(List.of(
                new VegetationWorkflow(timeSeries, change),
                new TemperatureWorkflow(timeSeries, change),
                new PrecipitationWorkflow(timeSeries, change),
                new WaterWorkflow(timeSeries, change),
                new AirQualityWorkflow(timeSeries, change)));
    }

    public WorkflowExecutor resolve(DataProduct product) {
        WorkflowExecutor w = workflows.get(product);
        if (w == null) {
            List<String> supported = supportedProducts();
            throw new UnsupportedWorkflowException("No workflow implemented for dataProduct=\"" + product.wireName()
                    + "\". Currently supported: " + String.join(", ", supported) + ".", supported);
        }
        return w;
    }

    public List<String> supportedProducts() {
        return workflows.keySet().stream().map(DataProduct::wireName).collect(Collectors.toList());
    }
}
