package fr.imt.launchpad.launchpad.exception;

import fr.imt.launchpad.launchpad.business.model.FailureKind;

/**
 * Exception thrown when a Docker image build or tagging fails.
 */
public class ImageBuildException extends LaunchpadException {

    private static final String ERROR_CODE = "BUILD_ERR";

    public ImageBuildException(String imageName, String operation, Throwable cause) {
        super(ERROR_CODE, FailureKind.BUILD_FAILED, "Failed to " + operation + " image: " + imageName, cause);
    }

    public ImageBuildException(String message, Throwable cause) {
        super(ERROR_CODE, FailureKind.BUILD_FAILED, message, cause);
    }
}
