package space.ketterling.geoanalysis.workflow;

/**
 * How a mean before/after delta is reported as {@code changePercent}.
 */
public enum ChangeMetric {
    /** Delta of a 0..1 quantity, times 100. */
    SCALED_FRACTION,
    /** Delta in the quantity's own unit. */
    ABSOLUTE_DIFFERENCE,
    /** Delta relative to the before-period mean, times 100. */
    PERCENT_OF_BASELINE
}
