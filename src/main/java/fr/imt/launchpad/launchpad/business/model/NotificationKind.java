package fr.imt.launchpad.launchpad.business.model;

public enum NotificationKind {
    SUCCESS,
    FAILURE;

    public static NotificationKind of(RunStatus status) {
        return status == RunStatus.SUCCESS ? SUCCESS : FAILURE;
    }
}
