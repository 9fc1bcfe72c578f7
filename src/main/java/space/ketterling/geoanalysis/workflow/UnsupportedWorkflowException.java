package space.ketterling.geoanalysis.workflow;

import space.ketterling.geoanalysis.AnalysisException;

import java.util.List;

/**
 * No workflow handles the requested data product or dataset.
 */
public final class UnsupportedWorkflowException extends AnalysisException {
    private final List<String> supported;

    public UnsupportedWorkflowException(String message, List<String> supported) {
        super("unsupported_workflow", message);
        this.supported = List.copyOf(supported);
    }

    public List<String> supported() {
        return supported;
    }
}
