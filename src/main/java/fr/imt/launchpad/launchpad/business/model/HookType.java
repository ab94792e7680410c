package fr.imt.launchpad.launchpad.business.model;

public enum HookType {
    SUCCESS,
    FAILURE,
    ALWAYS
}
