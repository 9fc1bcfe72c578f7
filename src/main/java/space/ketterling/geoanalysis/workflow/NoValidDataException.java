package space.ketterling.geoanalysis.workflow;

import space.ketterling.geoanalysis.AnalysisException;
import space.ketterling.geoanalysis.plan.TimeRange;

/**
 * The engine returned no usable value for the requested window and area.
 */
public final class NoValidDataException extends AnalysisException {

    public NoValidDataException(String phenomenon, TimeRange range, String location) {
        this("No valid " + phenomenon + " data found for " + range + " at " + location + ".");
    }

    public NoValidDataException(String message) {
        super("no_valid_data", message);
    }
}
