package fr.imt.launchpad.launchpad.business.model;

/**
 * Result of verifying an image in a disposable container, with the container's log tail when unhealthy.
 */
public record HealthReport(HealthStatus status, String url, String diagnostics) {

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
