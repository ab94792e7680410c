package fr.imt.launchpad.launchpad.business.port;

import fr.imt.launchpad.launchpad.business.model.ContainerSpec;
import fr.imt.launchpad.launchpad.business.model.Credential;

import java.nio.file.Path;
import java.util.List;

/**
 * Container engine operations used by the image, health and deployment services.
 */
public interface ContainerRuntimePort {

    /**
     * Build an untagged image and return its id.
     */
    String buildImage(String runId, Path buildContext, String dockerfile);

    void tagImage(String imageId, String imageName, String tag);

    void removeTag(String reference);

    RegistrySession openRegistrySession(String registry, Credential credential);

    String runContainer(ContainerSpec spec);

    /**
     * Stop and remove a container by name. Returns false when there was none.
     */
    boolean stopAndRemoveContainer(String name);

    String containerLogs(String name, int tailLines);

    List<String> listRunContainers(String runId);

    void pruneDanglingImages();
}
