package fr.imt.launchpad.launchpad.business.service.health;

import fr.imt.launchpad.launchpad.business.model.DeploymentTarget;
import fr.imt.launchpad.launchpad.business.model.HealthReport;
import fr.imt.launchpad.launchpad.business.model.HealthStatus;
import fr.imt.launchpad.launchpad.business.model.ImageReference;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.port.LivenessProbePort;
import fr.imt.launchpad.launchpad.business.port.RunLogPublisherPort;
import fr.imt.launchpad.launchpad.business.service.deployment.ContainerLifecycleService;
import fr.imt.launchpad.launchpad.testutil.FakeContainerRuntime;
import fr.imt.launchpad.launchpad.testutil.TestRuns;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthGateTest {

    private static final Duration BUDGET = Duration.ofMillis(300);
    private static final Duration INTERVAL = Duration.ofMillis(10);

    @Mock
    private LivenessProbePort livenessProbe;

    private final RunLogPublisherPort logPublisher = (runId, message) -> { };
    private FakeContainerRuntime runtime;
    private HealthGate healthGate;
    private RunContext context;
    private final ImageReference image = new ImageReference("docker.io", "acme/telco-churn", List.of("42", "latest"));

    @BeforeEach
    void setUp() {
        runtime = new FakeContainerRuntime();
        healthGate = new HealthGate(livenessProbe, new ContainerLifecycleService(runtime, logPublisher),
                logPublisher, TestRuns.fastProperties());
        context = TestRuns.context("42");
    }

    @Test
    void endpointAnsweringAfterAFewPollsIsHealthy() {
        when(livenessProbe.isLive("http://localhost:5001/health")).thenReturn(false, false, true);

        HealthStatus status = healthGate.checkLiveness(new DeploymentTarget("app", 5001, "img", "id"),
                "/health", BUDGET, INTERVAL);

        assertThat(status).isEqualTo(HealthStatus.HEALTHY);
        verify(livenessProbe, times(3)).isLive("http://localhost:5001/health");
    }

    @Test
    void endpointNeverAnsweringIsUnhealthyOnceTheBudgetIsSpent() {
        when(livenessProbe.isLive(anyString())).thenReturn(false);

        long start = System.nanoTime();
        HealthStatus status = healthGate.checkLiveness(new DeploymentTarget("app", 5001, "img", "id"),
                "health", BUDGET, INTERVAL);
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        assertThat(status).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(elapsedMillis).isGreaterThanOrEqualTo(BUDGET.toMillis() - INTERVAL.toMillis());
        verify(livenessProbe, atLeast(2)).isLive("http://localhost:5001/health");
    }

    @Test
    void probeErrorsCountAsNotReady() {
        when(livenessProbe.isLive(anyString()))
                .thenThrow(new IllegalStateException("connection refused"))
                .thenReturn(true);

        HealthStatus status = healthGate.checkLiveness(new DeploymentTarget("app", 5001, "img", "id"),
                "/health", BUDGET, INTERVAL);

        assertThat(status).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    void healthyImageIsReportedAndItsContainerRemoved() {
        when(livenessProbe.isLive(anyString())).thenReturn(true);

        HealthReport report = healthGate.verifyImage(context, image, "telco-churn-staging-test-42", 5001, 5000,
                "/health", BUDGET, INTERVAL);

        assertThat(report.isHealthy()).isTrue();
        assertThat(runtime.containers()).isEmpty();
        assertThat(runtime.removedContainers()).contains("telco-churn-staging-test-42");
    }

    @Test
    void unhealthyImageCarriesContainerLogsAndItsContainerIsStillRemoved() {
        when(livenessProbe.isLive(anyString())).thenReturn(false);
        runtime.setLogs("Traceback: model.pkl not found");

        HealthReport report = healthGate.verifyImage(context, image, "telco-churn-staging-test-42", 5001, 5000,
                "/health", BUDGET, INTERVAL);

        assertThat(report.status()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(report.url()).isEqualTo("http://localhost:5001/health");
        assertThat(report.diagnostics()).contains("model.pkl not found");
        assertThat(runtime.containers()).isEmpty();
    }

    @Test
    void leftoverTestContainerIsReplaced() {
        runtime.addContainer("telco-churn-staging-test-42", "old", 5001, Map.of());
        when(livenessProbe.isLive(anyString())).thenReturn(true);

        healthGate.verifyImage(context, image, "telco-churn-staging-test-42", 5001, 5000, "/health", BUDGET, INTERVAL);

        assertThat(runtime.removedContainers()).containsExactly("telco-churn-staging-test-42", "telco-churn-staging-test-42");
        assertThat(runtime.containers()).isEmpty();
    }
}
