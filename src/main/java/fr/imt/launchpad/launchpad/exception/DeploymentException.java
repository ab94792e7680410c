package fr.imt.launchpad.launchpad.exception;

import fr.imt.launchpad.launchpad.business.model.FailureKind;

/**
 * Exception thrown when a deployment cannot be started or does not become healthy.
 */
public class DeploymentException extends LaunchpadException {

    private static final String ERROR_CODE = "DEPLOY_ERR";

    public DeploymentException(String message) {
        super(ERROR_CODE, FailureKind.DEPLOY_FAILED, message);
    }

    public DeploymentException(String message, Throwable cause) {
        super(ERROR_CODE, FailureKind.DEPLOY_FAILED, message, cause);
    }
}
