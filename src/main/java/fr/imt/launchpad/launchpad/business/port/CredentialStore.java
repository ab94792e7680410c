package fr.imt.launchpad.launchpad.business.port;

import fr.imt.launchpad.launchpad.business.model.Credential;

public interface CredentialStore {

    /**
     * @throws fr.imt.launchpad.launchpad.exception.CredentialNotFoundException when no usable credential has this name
     */
    Credential resolve(String name);
}
