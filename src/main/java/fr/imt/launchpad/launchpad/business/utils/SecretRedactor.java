package fr.imt.launchpad.launchpad.business.utils;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Replaces every registered secret value with a mask by plain substring match.
 * Longer values are replaced first so a secret containing another one is fully masked.
 */
public class SecretRedactor {

    public static final String MASK = "****";

    private final Set<String> secrets = new CopyOnWriteArraySet<>();

    public void register(String secret) {
        if (secret != null && !secret.isEmpty()) {
            secrets.add(secret);
        }
    }

    public String redact(String text) {
        if (text == null || text.isEmpty() || secrets.isEmpty()) {
            return text;
        }
        List<String> ordered = secrets.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
        String redacted = text;
        for (String secret : ordered) {
            redacted = redacted.replace(secret, MASK);
        }
        return redacted;
    }

    public boolean isEmpty() {
        return secrets.isEmpty();
    }
}
