package fr.imt.launchpad.launchpad.business.model;

import java.util.Collection;
import java.util.Map;

/**
 * Resolved credential. The id is display-safe, the secret fields are not.
 */
public record Credential(String id, Map<String, String> secrets) {

    public static final String USERNAME = "username";
    public static final String PASSWORD = "password";

    public Credential {
        secrets = Map.copyOf(secrets);
    }

    public static Credential usernamePassword(String id, String username, String password) {
        return new Credential(id, Map.of(USERNAME, username, PASSWORD, password));
    }

    public String username() {
        return secrets.get(USERNAME);
    }

    public String password() {
        return secrets.get(PASSWORD);
    }

    public Collection<String> secretValues() {
        return secrets.values();
    }

    @Override
    public String toString() {
        return "Credential[id=" + id + ", fields=" + secrets.keySet() + "]";
    }
}
