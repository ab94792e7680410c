package fr.imt.launchpad.launchpad.business.utils;

import lombok.experimental.UtilityClass;

@UtilityClass
public class Constants {

    public static final String MANAGED_LABEL = "launchpad.managed";
    public static final String RUN_LABEL = "launchpad.run-id";
    public static final String ROLE_LABEL = "launchpad.role";
    public static final String ROLE_EPHEMERAL = "ephemeral";
    public static final String ROLE_DEPLOYMENT = "deployment";
    public static final String FLOATING_TAG = "latest";
    public static final int MAX_CAPTURED_OUTPUT = 8192;

    /**
     * Keep the tail of long output, where failures usually are.
     */
    public static String tail(String output, int maxLength) {
        if (output == null || output.length() <= maxLength) {
            return output;
        }
        return "...[truncated]\n" + output.substring(output.length() - maxLength);
    }
}
