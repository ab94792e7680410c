package fr.imt.launchpad.launchpad.exception;

import fr.imt.launchpad.launchpad.business.model.FailureKind;

/**
 * Exception thrown when a liveness endpoint does not answer successfully within its budget.
 */
public class HealthCheckTimeoutException extends LaunchpadException {

    private static final String ERROR_CODE = "HEALTH_TIMEOUT";

    public HealthCheckTimeoutException(String message) {
        super(ERROR_CODE, FailureKind.TIMEOUT, message);
    }
}
