package fr.imt.launchpad.launchpad.business.service;

import fr.imt.launchpad.launchpad.business.model.Pipeline;
import fr.imt.launchpad.launchpad.business.model.ResourceClaim;
import fr.imt.launchpad.launchpad.business.model.RunStatus;
import fr.imt.launchpad.launchpad.business.model.Stage;
import fr.imt.launchpad.launchpad.business.model.StageType;
import fr.imt.launchpad.launchpad.business.port.CredentialStore;
import fr.imt.launchpad.launchpad.business.service.deployment.DeploymentManager;
import fr.imt.launchpad.launchpad.business.service.health.HealthGate;
import fr.imt.launchpad.launchpad.business.service.image.ImageBuildService;
import fr.imt.launchpad.launchpad.business.service.notification.NotificationPayloadFactory;
import fr.imt.launchpad.launchpad.business.service.notification.Notifier;
import fr.imt.launchpad.launchpad.business.service.stages.CommandStageWork;
import fr.imt.launchpad.launchpad.business.service.stages.DeployStageWork;
import fr.imt.launchpad.launchpad.business.service.stages.ImageBuildStageWork;
import fr.imt.launchpad.launchpad.business.service.stages.ImagePushStageWork;
import fr.imt.launchpad.launchpad.business.service.stages.ImageTestStageWork;
import fr.imt.launchpad.launchpad.configuration.LaunchpadProperties;
import fr.imt.launchpad.launchpad.configuration.LaunchpadProperties.StageDefinition;
import fr.imt.launchpad.launchpad.exception.PipelineDefinitionException;
import fr.imt.launchpad.launchpad.testutil.TestRuns;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PipelineFactoryTest {

    @Mock
    private ImageBuildService imageBuildService;
    @Mock
    private HealthGate healthGate;
    @Mock
    private DeploymentManager deploymentManager;
    @Mock
    private CredentialStore credentialStore;
    @Mock
    private Notifier notifier;
    @Mock
    private RunCleanupService runCleanupService;

    private LaunchpadProperties properties;
    private PipelineFactory pipelineFactory;

    @BeforeEach
    void setUp() {
        properties = TestRuns.fastProperties();
        properties.getPipeline().setStages(List.of(
                definition("Train Model", StageType.COMMAND, List.of("python", "model_training.py"), Duration.ofMinutes(30)),
                definition("Build Docker Image", StageType.IMAGE_BUILD, List.of(), null),
                definition("Test Docker Image", StageType.IMAGE_TEST, List.of(), Duration.ofMinutes(5)),
                definition("Push Docker Image", StageType.IMAGE_PUSH, List.of(), null),
                definition("Deploy to Staging", StageType.DEPLOY, List.of(), null)));

        pipelineFactory = new PipelineFactory(properties, imageBuildService, healthGate, deploymentManager,
                credentialStore, (runId, message) -> { }, notifier, new NotificationPayloadFactory(properties),
                runCleanupService, Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void stagesFollowTheDeclaredOrderAndTypes() {
        Pipeline pipeline = pipelineFactory.create();

        assertThat(pipeline.getStages()).extracting(Stage::name).containsExactly(
                "Train Model", "Build Docker Image", "Test Docker Image", "Push Docker Image", "Deploy to Staging");
        assertThat(pipeline.getStages()).<Class<?>>extracting(stage -> stage.work().getClass()).containsExactly(
                CommandStageWork.class, ImageBuildStageWork.class, ImageTestStageWork.class,
                ImagePushStageWork.class, DeployStageWork.class);
        assertThat(pipeline.getStages().get(0).timeout()).isEqualTo(Duration.ofMinutes(30));
        assertThat(pipeline.getStages().get(1).timeoutOpt()).isEmpty();
    }

    @Test
    void pushStageDeclaresTheRegistryCredential() {
        assertThat(pipelineFactory.create().getCredentials()).containsExactly("docker-hub-credentials");
    }

    @Test
    void stagesDeclareTheResourcesTheyAcquire() {
        Pipeline pipeline = pipelineFactory.create();

        assertThat(pipeline.getStages().get(2).claims()).contains(ResourceClaim.port(5001));
        assertThat(pipeline.getStages().get(3).claims()).containsExactly(ResourceClaim.registrySession("docker.io"));
        assertThat(pipeline.getStages().get(4).claims())
                .containsExactly(ResourceClaim.container("telco-churn-staging"), ResourceClaim.port(5000));
    }

    @Test
    void commandStageWithoutCommandIsRejected() {
        assertThatThrownBy(() -> pipelineFactory.createStage(definition("Train", StageType.COMMAND, List.of(), null)))
                .isInstanceOf(PipelineDefinitionException.class)
                .hasMessageContaining("no command");
    }

    @Test
    void stageWithoutTypeIsRejected() {
        assertThatThrownBy(() -> pipelineFactory.createStage(definition("Train", null, List.of("make"), null)))
                .isInstanceOf(PipelineDefinitionException.class);
    }

    @Test
    void pipelineWithoutStagesIsRejected() {
        properties.getPipeline().setStages(List.of());

        assertThatThrownBy(() -> pipelineFactory.create()).isInstanceOf(PipelineDefinitionException.class);
    }

    @Test
    void alwaysHookRunsTheCleanup() throws Exception {
        Pipeline pipeline = pipelineFactory.create();
        var context = TestRuns.context("42");

        pipeline.getPostActions().always().run(RunStatus.SUCCESS, context);

        verify(runCleanupService).cleanup(context);
    }

    @Test
    void terminalHooksNotifyUnlessDisabled() throws Exception {
        Pipeline pipeline = pipelineFactory.create();
        var context = TestRuns.context("42");

        pipeline.getPostActions().onFailure().run(RunStatus.FAILURE, context);
        verify(notifier).notify(any(), any());

        properties.getNotification().setEnabled(false);
        Notifier silent = mock(Notifier.class);
        PipelineFactory quiet = new PipelineFactory(properties, imageBuildService, healthGate, deploymentManager,
                credentialStore, (runId, message) -> { }, silent, new NotificationPayloadFactory(properties),
                runCleanupService, Clock.systemUTC());
        quiet.create().getPostActions().onSuccess().run(RunStatus.SUCCESS, context);
        verify(silent, never()).notify(any(), any());
    }

    private static StageDefinition definition(String name, StageType type, List<String> command, Duration timeout) {
        StageDefinition definition = new StageDefinition();
        definition.setName(name);
        definition.setType(type);
        definition.setCommand(command);
        definition.setTimeout(timeout);
        return definition;
    }
}
