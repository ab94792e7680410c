package fr.imt.launchpad.launchpad.exception;

import fr.imt.launchpad.launchpad.business.model.FailureKind;

import java.util.List;

/**
 * Exception thrown when registry authentication or a tag push fails.
 * Tags pushed before the failure stay in the registry.
 */
public class ImagePublishException extends LaunchpadException {

    private static final String ERROR_CODE = "PUBLISH_ERR";

    private final List<String> pushedTags;

    public ImagePublishException(String message, List<String> pushedTags, Throwable cause) {
        super(ERROR_CODE, FailureKind.PUBLISH_FAILED, message, cause);
        this.pushedTags = List.copyOf(pushedTags);
    }

    public List<String> getPushedTags() {
        return pushedTags;
    }
}
