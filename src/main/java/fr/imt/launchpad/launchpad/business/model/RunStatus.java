package fr.imt.launchpad.launchpad.business.model;

public enum RunStatus {
    SUCCESS,
    FAILURE
}
