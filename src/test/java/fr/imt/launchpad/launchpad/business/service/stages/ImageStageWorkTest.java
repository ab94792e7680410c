package fr.imt.launchpad.launchpad.business.service.stages;

import fr.imt.launchpad.launchpad.business.model.Credential;
import fr.imt.launchpad.launchpad.business.model.HealthReport;
import fr.imt.launchpad.launchpad.business.model.HealthStatus;
import fr.imt.launchpad.launchpad.business.model.ImageReference;
import fr.imt.launchpad.launchpad.business.model.ProcessResult;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.port.CredentialStore;
import fr.imt.launchpad.launchpad.business.service.health.HealthGate;
import fr.imt.launchpad.launchpad.business.service.image.ImageBuildService;
import fr.imt.launchpad.launchpad.configuration.LaunchpadProperties;
import fr.imt.launchpad.launchpad.exception.CredentialNotFoundException;
import fr.imt.launchpad.launchpad.exception.HealthCheckTimeoutException;
import fr.imt.launchpad.launchpad.testutil.TestRuns;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImageStageWorkTest {

    @Mock
    private ImageBuildService imageBuildService;
    @Mock
    private HealthGate healthGate;
    @Mock
    private CredentialStore credentialStore;

    private final LaunchpadProperties properties = TestRuns.fastProperties();
    private RunContext context;

    @BeforeEach
    void setUp() {
        context = TestRuns.context("42");
    }

    @Test
    void buildStoresTheBuiltImageInTheRun() {
        ImageReference built = context.getPlannedImage();
        when(imageBuildService.build(context, Path.of("."), "Dockerfile", "docker.io", "acme/telco-churn",
                List.of("42", "latest"))).thenReturn(built);

        ProcessResult result = new ImageBuildStageWork(imageBuildService, Path.of("."), "Dockerfile").execute(context);

        assertThat(result.isSuccess()).isTrue();
        assertThat(context.getBuiltImage()).isEqualTo(built);
    }

    @Test
    void testWithoutABuiltImageFails() {
        ProcessResult result = new ImageTestStageWork(healthGate, "telco-churn-staging", 5000, properties.getHealth())
                .execute(context);

        assertThat(result.isSuccess()).isFalse();
        verifyNoInteractions(healthGate);
    }

    @Test
    void unhealthyImageTimesOutWithDiagnostics() {
        context.setBuiltImage(context.getPlannedImage());
        when(healthGate.verifyImage(eq(context), any(), eq("telco-churn-staging-test-42"), eq(5001), eq(5000),
                anyString(), any(), any()))
                .thenReturn(new HealthReport(HealthStatus.UNHEALTHY, "http://localhost:5001/health", "OOMKilled"));

        ImageTestStageWork work = new ImageTestStageWork(healthGate, "telco-churn-staging", 5000, properties.getHealth());

        assertThatThrownBy(() -> work.execute(context))
                .isInstanceOf(HealthCheckTimeoutException.class)
                .hasMessageContaining("http://localhost:5001/health")
                .hasMessageContaining("OOMKilled");
    }

    @Test
    void pushRegistersTheCredentialForRedactionBeforePublishing() {
        context.setBuiltImage(context.getPlannedImage());
        Credential credential = Credential.usernamePassword("docker-hub-credentials", "acme", "hub-token");
        when(credentialStore.resolve("docker-hub-credentials")).thenReturn(credential);

        new ImagePushStageWork(imageBuildService, credentialStore, "docker-hub-credentials").execute(context);

        verify(imageBuildService).publish(context, context.getPlannedImage(), credential);
        assertThat(context.redact("hub-token")).isEqualTo("****");
        assertThat(context.credential("docker-hub-credentials")).contains(credential);
    }

    @Test
    void pushReusesACredentialLoadedBeforeTheRun() {
        context.setBuiltImage(context.getPlannedImage());
        Credential credential = Credential.usernamePassword("docker-hub-credentials", "acme", "hub-token");
        context.registerCredential(credential);

        new ImagePushStageWork(imageBuildService, credentialStore, "docker-hub-credentials").execute(context);

        verify(imageBuildService).publish(context, context.getPlannedImage(), credential);
        verify(credentialStore, never()).resolve(any());
    }

    @Test
    void pushWithMissingCredentialNeverTouchesTheRegistry() {
        context.setBuiltImage(context.getPlannedImage());
        when(credentialStore.resolve("docker-hub-credentials"))
                .thenThrow(new CredentialNotFoundException("docker-hub-credentials"));

        ImagePushStageWork work = new ImagePushStageWork(imageBuildService, credentialStore, "docker-hub-credentials");

        assertThatThrownBy(() -> work.execute(context)).isInstanceOf(CredentialNotFoundException.class);
        verify(imageBuildService, never()).publish(any(), any(), any());
    }
}
