package fr.imt.launchpad.launchpad.exception;

import fr.imt.launchpad.launchpad.business.model.FailureKind;

/**
 * Exception thrown by notification transports. Never escapes the notifier.
 */
public class NotificationDispatchException extends LaunchpadException {

    private static final String ERROR_CODE = "NOTIFY_ERR";

    public NotificationDispatchException(String message, Throwable cause) {
        super(ERROR_CODE, FailureKind.NOTIFICATION_DISPATCH_FAILED, message, cause);
    }
}
