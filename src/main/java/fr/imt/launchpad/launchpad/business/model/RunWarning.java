package fr.imt.launchpad.launchpad.business.model;

public record RunWarning(String code, String message) {

    public static final String NOTIFICATION_DISPATCH_FAILED = "NOTIFICATION_DISPATCH_FAILED";
    public static final String HOOK_FAILED = "HOOK_FAILED";
    public static final String RUN_CANCELLED = "RUN_CANCELLED";
    public static final String CLEANUP_INCOMPLETE = "CLEANUP_INCOMPLETE";

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
