package fr.imt.launchpad.launchpad.exception;

import fr.imt.launchpad.launchpad.business.model.FailureKind;

/**
 * Exception thrown when a named credential is not configured.
 */
public class CredentialNotFoundException extends LaunchpadException {

    private static final String ERROR_CODE = "CREDENTIAL_NOT_FOUND";

    public CredentialNotFoundException(String credentialName) {
        super(ERROR_CODE, FailureKind.CREDENTIAL_NOT_FOUND, "Credential not found: " + credentialName);
    }
}
