package fr.imt.launchpad.launchpad.business.utils;

import lombok.experimental.UtilityClass;

@UtilityClass
public class TagSanitizer {

    private static final int MAX_TAG_LENGTH = 128;

    /**
     * Turn a run identifier into a valid image tag: [A-Za-z0-9_.-], not starting with '.' or '-', at most 128 chars.
     */
    public static String sanitizeTag(String value) {
        String sanitized = value
                .replaceAll("[^a-zA-Z0-9._-]", "_")
                .replaceAll("^[.-]+", "_");
        return sanitized.length() > MAX_TAG_LENGTH ? sanitized.substring(0, MAX_TAG_LENGTH) : sanitized;
    }
}
