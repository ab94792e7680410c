package fr.imt.launchpad.launchpad.business.model;

public enum HealthStatus {
    HEALTHY,
    UNHEALTHY
}
