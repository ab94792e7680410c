package fr.imt.launchpad.launchpad.business.service.stages;

import fr.imt.launchpad.launchpad.business.model.HealthReport;
import fr.imt.launchpad.launchpad.business.model.ImageReference;
import fr.imt.launchpad.launchpad.business.model.ProcessResult;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.model.StageWork;
import fr.imt.launchpad.launchpad.business.service.health.HealthGate;
import fr.imt.launchpad.launchpad.configuration.LaunchpadProperties;
import fr.imt.launchpad.launchpad.exception.HealthCheckTimeoutException;
import lombok.RequiredArgsConstructor;

/**
 * Runs the freshly built image in a disposable container and checks its liveness endpoint.
 */
@RequiredArgsConstructor
public class ImageTestStageWork implements StageWork {

    private final HealthGate healthGate;
    private final String instanceNamePrefix;
    private final int containerPort;
    private final LaunchpadProperties.Health health;

    @Override
    public ProcessResult execute(RunContext context) {
        ImageReference image = context.getBuiltImage();
        if (image == null) {
            return new ProcessResult(1, "No image was built earlier in this run");
        }

        String instanceName = instanceNamePrefix + "-test-" + context.getRunId();
        HealthReport report = healthGate.verifyImage(context, image, instanceName, health.getTestPort(), containerPort,
                health.getPath(), health.getBudget(), health.getPollInterval());

        if (!report.isHealthy()) {
            throw new HealthCheckTimeoutException(String.format(
                    "%s did not answer successfully within %s (polled every %s)%nContainer logs:%n%s",
                    report.url(), health.getBudget(), health.getPollInterval(), report.diagnostics()));
        }
        return ProcessResult.success("Health check passed: " + report.url());
    }
}
