package fr.imt.launchpad.launchpad.business.model;

public enum StageStatus {
    SUCCEEDED,
    FAILED,
    SKIPPED
}
