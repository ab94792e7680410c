package fr.imt.launchpad.launchpad.business.service;

import fr.imt.launchpad.launchpad.business.model.DeploymentTarget;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.model.RunWarning;
import fr.imt.launchpad.launchpad.business.port.ContainerRuntimePort;
import fr.imt.launchpad.launchpad.business.port.RunLogPublisherPort;
import fr.imt.launchpad.launchpad.configuration.LaunchpadProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes what a run left behind, except the deployment it produced.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RunCleanupService {

    private final ContainerRuntimePort containerRuntime;
    private final RunLogPublisherPort logPublisher;
    private final LaunchpadProperties properties;

    public void cleanup(RunContext context) {
        String runId = context.getRunId();
        DeploymentTarget deployment = context.getDeployment();
        String keep = deployment != null ? deployment.name() : null;

        List<String> failed = new ArrayList<>();
        try {
            for (String name : containerRuntime.listRunContainers(runId)) {
                if (name.equals(keep)) {
                    continue;
                }
                try {
                    containerRuntime.stopAndRemoveContainer(name);
                    log.info("Removed leftover container {} of run {}", name, runId);
                } catch (RuntimeException e) {
                    log.warn("Failed to remove leftover container {} of run {}", name, runId, e);
                    failed.add(name);
                }
            }
        } catch (RuntimeException e) {
            log.warn("Could not list containers of run {}", runId, e);
            context.addWarning(RunWarning.CLEANUP_INCOMPLETE, "Could not list run containers: " + e.getMessage());
        }

        if (!failed.isEmpty()) {
            context.addWarning(RunWarning.CLEANUP_INCOMPLETE, "Containers left behind: " + failed);
        }

        if (properties.getCleanup().isPruneImages()) {
            try {
                containerRuntime.pruneDanglingImages();
            } catch (RuntimeException e) {
                log.warn("Pruning dangling images failed after run {}", runId, e);
            }
        }

        logPublisher.publish(runId, "Cleanup finished");
    }
}
