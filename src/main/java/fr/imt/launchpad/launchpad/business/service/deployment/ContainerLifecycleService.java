package fr.imt.launchpad.launchpad.business.service.deployment;

import fr.imt.launchpad.launchpad.business.model.ContainerSpec;
import fr.imt.launchpad.launchpad.business.model.DeploymentTarget;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.port.ContainerRuntimePort;
import fr.imt.launchpad.launchpad.business.port.RunLogPublisherPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

import static fr.imt.launchpad.launchpad.business.utils.Constants.MANAGED_LABEL;
import static fr.imt.launchpad.launchpad.business.utils.Constants.ROLE_EPHEMERAL;
import static fr.imt.launchpad.launchpad.business.utils.Constants.ROLE_LABEL;
import static fr.imt.launchpad.launchpad.business.utils.Constants.RUN_LABEL;

/**
 * Starts and removes named containers for the deployment manager and the health gate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContainerLifecycleService {

    private final ContainerRuntimePort containerRuntime;
    private final RunLogPublisherPort logPublisher;

    /**
     * Stop and remove the container with this name. Absence is not an error.
     *
     * @return true if a container was removed
     */
    public boolean removeIfPresent(RunContext context, String name) {
        boolean removed = containerRuntime.stopAndRemoveContainer(name);
        if (removed) {
            log.info("Removed container {} for run {}", name, context.getRunId());
            logPublisher.publish(context.getRunId(), "Stopped and removed container " + name);
        } else {
            log.debug("No container named {} to remove", name);
        }
        return removed;
    }

    public DeploymentTarget start(RunContext context, String name, String image, int hostPort, int containerPort,
                                  String role, Map<String, String> env) {
        ContainerSpec spec = ContainerSpec.builder()
                .name(name)
                .image(image)
                .hostPort(hostPort)
                .containerPort(containerPort)
                .env(env)
                .labels(Map.of(
                        MANAGED_LABEL, "true",
                        RUN_LABEL, context.getRunId(),
                        ROLE_LABEL, role))
                .build();

        logPublisher.publish(context.getRunId(),
                String.format("Starting container %s from %s on port %d", name, image, hostPort));
        String containerId = containerRuntime.runContainer(spec);
        log.info("Container {} ({}) started from {} on port {}", name, shortId(containerId), image, hostPort);
        return new DeploymentTarget(name, hostPort, image, containerId);
    }

    /**
     * Start a disposable container. Closing the returned handle removes it.
     */
    public EphemeralContainer startEphemeral(RunContext context, String name, String image, int hostPort, int containerPort) {
        removeIfPresent(context, name);
        DeploymentTarget target = start(context, name, image, hostPort, containerPort, ROLE_EPHEMERAL, Map.of());
        return new EphemeralContainer(this, context, target);
    }

    public String logs(String name, int tailLines) {
        try {
            return containerRuntime.containerLogs(name, tailLines);
        } catch (RuntimeException e) {
            log.warn("Could not read logs of container {}", name, e);
            return "";
        }
    }

    private static String shortId(String containerId) {
        return containerId != null && containerId.length() > 12 ? containerId.substring(0, 12) : containerId;
    }
}
