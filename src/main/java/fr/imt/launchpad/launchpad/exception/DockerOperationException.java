package fr.imt.launchpad.launchpad.exception;

import fr.imt.launchpad.launchpad.business.model.FailureKind;

/**
 * Exception thrown when Docker client operations fail.
 */
public class DockerOperationException extends LaunchpadException {

    private static final String ERROR_CODE = "DOCKER_ERR";

    public DockerOperationException(String operation, Throwable cause) {
        super(ERROR_CODE, FailureKind.WORK_FAILED, "Docker operation failed: " + operation, cause);
    }

    public DockerOperationException(String message) {
        super(ERROR_CODE, FailureKind.WORK_FAILED, message);
    }
}
