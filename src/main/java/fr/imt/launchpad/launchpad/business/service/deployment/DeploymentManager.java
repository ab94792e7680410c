package fr.imt.launchpad.launchpad.business.service.deployment;

import fr.imt.launchpad.launchpad.business.model.DeploymentTarget;
import fr.imt.launchpad.launchpad.business.model.HealthStatus;
import fr.imt.launchpad.launchpad.business.model.ImageReference;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.port.RunLogPublisherPort;
import fr.imt.launchpad.launchpad.business.service.health.HealthGate;
import fr.imt.launchpad.launchpad.business.utils.Constants;
import fr.imt.launchpad.launchpad.configuration.LaunchpadProperties;
import fr.imt.launchpad.launchpad.exception.DeploymentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Replaces a named instance with a new one and checks it is healthy.
 * A failed health check leaves the new instance running for inspection; there is no rollback.
 */
@Service
@Slf4j
public class DeploymentManager {

    private final ContainerLifecycleService containerLifecycle;
    private final HealthGate healthGate;
    private final RunLogPublisherPort logPublisher;
    private final LaunchpadProperties.Deployment deploymentProperties;
    private final LaunchpadProperties.Health healthProperties;

    public DeploymentManager(ContainerLifecycleService containerLifecycle,
                             HealthGate healthGate,
                             RunLogPublisherPort logPublisher,
                             LaunchpadProperties properties) {
        this.containerLifecycle = containerLifecycle;
        this.healthGate = healthGate;
        this.logPublisher = logPublisher;
        this.deploymentProperties = properties.getDeployment();
        this.healthProperties = properties.getHealth();
    }

    /**
     * Deploy an image under a fixed name. Calling it again with the same arguments leaves a single instance.
     *
     * @throws DeploymentException when the instance cannot start or is not healthy within the budget
     * @throws InterruptedException when interrupted during the settle wait
     */
    public DeploymentTarget deploy(RunContext context, String name, ImageReference image, int port)
            throws InterruptedException {
        String runId = context.getRunId();
        log.info("Deploying {} as {} on port {} for run {}", image.primaryReference(), name, port, runId);

        containerLifecycle.removeIfPresent(context, name);

        DeploymentTarget target;
        try {
            target = containerLifecycle.start(context, name, image.primaryReference(), port,
                    deploymentProperties.getContainerPort(), Constants.ROLE_DEPLOYMENT, deploymentProperties.getEnv());
        } catch (RuntimeException e) {
            log.error("Failed to start deployment {}", name, e);
            throw new DeploymentException("Failed to start " + name + ": " + e.getMessage(), e);
        }
        context.setDeployment(target);

        logPublisher.publish(runId, "Waiting " + deploymentProperties.getSettleInterval() + " for " + name + " to settle");
        Thread.sleep(deploymentProperties.getSettleInterval().toMillis());

        HealthStatus status = healthGate.checkLiveness(target, healthProperties.getPath(),
                healthProperties.getBudget(), healthProperties.getPollInterval());

        if (status == HealthStatus.UNHEALTHY) {
            String diagnostics = containerLifecycle.logs(name, 50);
            log.warn("Deployment {} is unhealthy; leaving it running for inspection", name);
            throw new DeploymentException(String.format(
                    "%s did not become healthy at %s within %s. The instance is left running for inspection.%n%s",
                    name, healthGate.urlOf(target, healthProperties.getPath()), healthProperties.getBudget(), diagnostics));
        }

        logPublisher.publish(runId, "Deployment " + name + " is healthy");
        return target;
    }
}
