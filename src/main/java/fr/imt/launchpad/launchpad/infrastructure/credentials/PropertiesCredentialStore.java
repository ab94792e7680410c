package fr.imt.launchpad.launchpad.infrastructure.credentials;

import fr.imt.launchpad.launchpad.business.model.Credential;
import fr.imt.launchpad.launchpad.business.port.CredentialStore;
import fr.imt.launchpad.launchpad.configuration.LaunchpadProperties;
import fr.imt.launchpad.launchpad.exception.CredentialNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Credentials declared under {@code launchpad.credentials}, usually bound to environment variables.
 * An entry whose fields are all blank counts as missing: the variables were not set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PropertiesCredentialStore implements CredentialStore {

    private final LaunchpadProperties properties;

    @Override
    public Credential resolve(String name) {
        LaunchpadProperties.CredentialProperties entry = properties.getCredentials().get(name);
        if (entry == null || (isBlank(entry.getUsername()) && isBlank(entry.getPassword()))) {
            log.warn("Credential {} is not configured", name);
            throw new CredentialNotFoundException(name);
        }
        log.debug("Resolved credential {}", name);
        return Credential.usernamePassword(name, nullToEmpty(entry.getUsername()), nullToEmpty(entry.getPassword()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
