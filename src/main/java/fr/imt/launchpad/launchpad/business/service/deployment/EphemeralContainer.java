package fr.imt.launchpad.launchpad.business.service.deployment;

import fr.imt.launchpad.launchpad.business.model.DeploymentTarget;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.model.RunWarning;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Scoped handle on a disposable container; {@link #close()} stops and removes it.
 */
@Slf4j
public class EphemeralContainer implements AutoCloseable {

    private final ContainerLifecycleService lifecycle;
    private final RunContext context;
    @Getter
    private final DeploymentTarget target;
    private boolean closed;

    EphemeralContainer(ContainerLifecycleService lifecycle, RunContext context, DeploymentTarget target) {
        this.lifecycle = lifecycle;
        this.context = context;
        this.target = target;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            lifecycle.removeIfPresent(context, target.name());
        } catch (RuntimeException e) {
            // the run cleanup hook sweeps containers labelled with the run id
            log.error("Failed to remove ephemeral container {}", target.name(), e);
            context.addWarning(RunWarning.CLEANUP_INCOMPLETE, "Ephemeral container " + target.name() + " was not removed");
        }
    }
}
