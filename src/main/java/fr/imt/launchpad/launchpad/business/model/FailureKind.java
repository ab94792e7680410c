package fr.imt.launchpad.launchpad.business.model;

public enum FailureKind {
    WORK_FAILED,
    TIMEOUT,
    ABORTED,
    CREDENTIAL_NOT_FOUND,
    BUILD_FAILED,
    PUBLISH_FAILED,
    DEPLOY_FAILED,
    NOTIFICATION_DISPATCH_FAILED
}
