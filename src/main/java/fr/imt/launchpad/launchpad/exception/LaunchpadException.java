package fr.imt.launchpad.launchpad.exception;

import fr.imt.launchpad.launchpad.business.model.FailureKind;

/**
 * Base exception class for all Launchpad domain exceptions.
 * Carries an error code for API responses and the failure kind a stage reports when the exception escapes its work.
 */
public class LaunchpadException extends RuntimeException {

    private final String errorCode;
    private final FailureKind failureKind;

    public LaunchpadException(String errorCode, FailureKind failureKind, String message) {
        super(message);
        this.errorCode = errorCode;
        this.failureKind = failureKind;
    }

    public LaunchpadException(String errorCode, FailureKind failureKind, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.failureKind = failureKind;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }
}
