package fr.imt.launchpad.launchpad.business.service.health;

import fr.imt.launchpad.launchpad.business.model.DeploymentTarget;
import fr.imt.launchpad.launchpad.business.model.HealthReport;
import fr.imt.launchpad.launchpad.business.model.HealthStatus;
import fr.imt.launchpad.launchpad.business.model.ImageReference;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.port.LivenessProbePort;
import fr.imt.launchpad.launchpad.business.port.RunLogPublisherPort;
import fr.imt.launchpad.launchpad.business.service.deployment.ContainerLifecycleService;
import fr.imt.launchpad.launchpad.business.service.deployment.EphemeralContainer;
import fr.imt.launchpad.launchpad.configuration.LaunchpadProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Polls a liveness endpoint until it answers successfully or the time budget is spent.
 */
@Service
@Slf4j
public class HealthGate {

    static final int DIAGNOSTIC_LOG_LINES = 50;

    private final LivenessProbePort livenessProbe;
    private final ContainerLifecycleService containerLifecycle;
    private final RunLogPublisherPort logPublisher;
    private final String host;

    public HealthGate(LivenessProbePort livenessProbe,
                      ContainerLifecycleService containerLifecycle,
                      RunLogPublisherPort logPublisher,
                      LaunchpadProperties properties) {
        this.livenessProbe = livenessProbe;
        this.containerLifecycle = containerLifecycle;
        this.logPublisher = logPublisher;
        this.host = properties.getDeployment().getHost();
    }

    public HealthStatus checkLiveness(DeploymentTarget target, String path, Duration timeoutBudget, Duration pollInterval) {
        String url = urlOf(target, path);

        RetryTemplate poller = RetryTemplate.builder()
                .withinMillis(timeoutBudget.toMillis())
                .fixedBackoff(Math.max(1L, pollInterval.toMillis()))
                .retryOn(EndpointNotReadyException.class)
                .build();

        return poller.execute(retryContext -> {
            if (probe(url)) {
                log.info("{} is healthy after {} attempt(s)", url, retryContext.getRetryCount() + 1);
                return HealthStatus.HEALTHY;
            }
            log.debug("{} not ready (attempt {})", url, retryContext.getRetryCount() + 1);
            throw new EndpointNotReadyException(url);
        }, retryContext -> {
            log.warn("{} did not become healthy within {} ({} attempts)", url, timeoutBudget, retryContext.getRetryCount());
            return HealthStatus.UNHEALTHY;
        });
    }

    /**
     * Start the image in a disposable container, check it and remove the container on every exit path.
     */
    public HealthReport verifyImage(RunContext context, ImageReference image, String instanceName, int hostPort,
                                    int containerPort, String path, Duration timeoutBudget, Duration pollInterval) {
        try (EphemeralContainer container = containerLifecycle.startEphemeral(
                context, instanceName, image.primaryReference(), hostPort, containerPort)) {

            String url = urlOf(container.getTarget(), path);
            logPublisher.publish(context.getRunId(), "Waiting for " + url + " (budget " + timeoutBudget + ")");

            HealthStatus status = checkLiveness(container.getTarget(), path, timeoutBudget, pollInterval);
            if (status == HealthStatus.HEALTHY) {
                logPublisher.publish(context.getRunId(), "Health check passed: " + url);
                return new HealthReport(status, url, "");
            }

            String diagnostics = containerLifecycle.logs(instanceName, DIAGNOSTIC_LOG_LINES);
            logPublisher.publish(context.getRunId(), "Health check failed: " + url);
            return new HealthReport(status, url, diagnostics);
        }
    }

    public String urlOf(DeploymentTarget target, String path) {
        String normalizedPath = path.startsWith("/") ? path : "/" + path;
        return "http://" + host + ":" + target.hostPort() + normalizedPath;
    }

    private boolean probe(String url) {
        try {
            return livenessProbe.isLive(url);
        } catch (RuntimeException e) {
            log.debug("Probe of {} failed: {}", url, e.getMessage());
            return false;
        }
    }

    static class EndpointNotReadyException extends RuntimeException {
        EndpointNotReadyException(String url) {
            super("Endpoint not ready: " + url);
        }
    }
}
