package fr.imt.launchpad.launchpad.exception;

import fr.imt.launchpad.launchpad.business.model.FailureKind;

/**
 * Exception thrown when a requested run is not found.
 */
public class RunNotFoundException extends LaunchpadException {

    private static final String ERROR_CODE = "NOT_FOUND";

    public RunNotFoundException(String runId) {
        super(ERROR_CODE, FailureKind.WORK_FAILED, "Run not found: " + runId);
    }
}
