package space.ketterling.geoanalysis.workflow;

import space.ketterling.geoanalysis.geo.BoundingBox;
import space.ketterling.geoanalysis.plan.AnalysisPlan;
import space.ketterling.geoanalysis.plan.DataProduct;

/**
 * Executes plans for one data product.
 */
public interface WorkflowExecutor {

    DataProduct dataProduct();

    WorkflowResult execute(AnalysisPlan plan, BoundingBox region);
}
