package fr.imt.launchpad.launchpad.business.model;

/**
 * A named running instance of an image bound to a host port.
 */
public record DeploymentTarget(String name, int hostPort, String imageReference, String containerId) {
}
