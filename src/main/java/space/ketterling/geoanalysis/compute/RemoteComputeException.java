package space.ketterling.geoanalysis.compute;

import space.ketterling.geoanalysis.AnalysisException;

/**
 * The compute engine failed, timed out, or refused the call.
 */
public final class RemoteComputeException extends AnalysisException {

    public RemoteComputeException(String message) {
        super("remote_compute_error", message);
    }

    public RemoteComputeException(String message, Throwable cause) {
        super("remote_compute_error", message, cause);
    }
}
