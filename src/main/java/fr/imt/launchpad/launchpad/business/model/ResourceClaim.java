package fr.imt.launchpad.launchpad.business.model;

/**
 * External resource a stage declares it acquires, e.g. a container name or a host port.
 */
public record ResourceClaim(Type type, String value) {

    public enum Type {
        CONTAINER,
        PORT,
        REGISTRY_SESSION,
        IMAGE_TAG
    }

    public static ResourceClaim container(String name) {
        return new ResourceClaim(Type.CONTAINER, name);
    }

    public static ResourceClaim port(int port) {
        return new ResourceClaim(Type.PORT, String.valueOf(port));
    }

    public static ResourceClaim registrySession(String registry) {
        return new ResourceClaim(Type.REGISTRY_SESSION, registry);
    }

    public static ResourceClaim imageTag(String reference) {
        return new ResourceClaim(Type.IMAGE_TAG, reference);
    }

    @Override
    public String toString() {
        return type.name().toLowerCase() + ":" + value;
    }
}
