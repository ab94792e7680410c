package fr.imt.launchpad.launchpad.business.port;

/**
 * Authenticated registry session. Closing it revokes the credentials it holds.
 */
public interface RegistrySession extends AutoCloseable {

    /**
     * Push one tag of an image, blocking until the registry has accepted it.
     */
    void push(String imageName, String tag);

    @Override
    void close();
}
