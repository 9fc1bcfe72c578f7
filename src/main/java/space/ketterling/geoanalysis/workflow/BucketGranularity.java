package space.ketterling.geoanalysis.workflow;

/**
 * Calendar unit a time series is split into.
 */
public enum BucketGranularity {
    MONTHLY,
    YEARLY
}
