package fr.imt.launchpad.launchpad.business.service;

import fr.imt.launchpad.launchpad.business.model.Pipeline;
import fr.imt.launchpad.launchpad.business.model.PostActions;
import fr.imt.launchpad.launchpad.business.model.ResourceClaim;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.model.RunStatus;
import fr.imt.launchpad.launchpad.business.model.Stage;
import fr.imt.launchpad.launchpad.business.model.StageType;
import fr.imt.launchpad.launchpad.business.model.StageWork;
import fr.imt.launchpad.launchpad.business.port.CredentialStore;
import fr.imt.launchpad.launchpad.business.port.RunLogPublisherPort;
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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Turns the configured stage descriptors into a runnable {@link Pipeline}.
 */
@Service
@Slf4j
public class PipelineFactory {

    private final Map<StageType, Function<StageDefinition, Stage>> registry = new EnumMap<>(StageType.class);

    private final LaunchpadProperties properties;
    private final Notifier notifier;
    private final NotificationPayloadFactory payloadFactory;
    private final RunCleanupService runCleanupService;
    private final Clock clock;

    public PipelineFactory(LaunchpadProperties properties,
                           ImageBuildService imageBuildService,
                           HealthGate healthGate,
                           DeploymentManager deploymentManager,
                           CredentialStore credentialStore,
                           RunLogPublisherPort logPublisher,
                           Notifier notifier,
                           NotificationPayloadFactory payloadFactory,
                           RunCleanupService runCleanupService,
                           Clock clock) {
        this.properties = properties;
        this.notifier = notifier;
        this.payloadFactory = payloadFactory;
        this.runCleanupService = runCleanupService;
        this.clock = clock;

        LaunchpadProperties.Image image = properties.getImage();
        LaunchpadProperties.Deployment deployment = properties.getDeployment();
        LaunchpadProperties.Health health = properties.getHealth();
        Path buildContext = Path.of(image.getBuildContext());

        registry.put(StageType.COMMAND, definition -> {
            if (definition.getCommand() == null || definition.getCommand().isEmpty()) {
                throw new PipelineDefinitionException("Stage '" + definition.getName() + "' has no command");
            }
            return stage(definition,
                    new CommandStageWork(List.copyOf(definition.getCommand()), buildContext, logPublisher),
                    List.of());
        });

        registry.put(StageType.IMAGE_BUILD, definition -> stage(definition,
                new ImageBuildStageWork(imageBuildService, buildContext, image.getDockerfile()),
                List.of(ResourceClaim.imageTag(image.getRepository()))));

        registry.put(StageType.IMAGE_TEST, definition -> stage(definition,
                new ImageTestStageWork(healthGate, deployment.getName(), deployment.getContainerPort(), health),
                List.of(ResourceClaim.container(deployment.getName() + "-test"), ResourceClaim.port(health.getTestPort()))));

        registry.put(StageType.IMAGE_PUSH, definition -> stage(definition,
                new ImagePushStageWork(imageBuildService, credentialStore, properties.getRegistryCredential()),
                List.of(ResourceClaim.registrySession(image.getRegistry()))));

        registry.put(StageType.DEPLOY, definition -> stage(definition,
                new DeployStageWork(deploymentManager, deployment.getName(), deployment.getHostPort()),
                List.of(ResourceClaim.container(deployment.getName()), ResourceClaim.port(deployment.getHostPort()))));
    }

    public Pipeline create() {
        LaunchpadProperties.PipelineDefinition definition = properties.getPipeline();
        if (definition.getStages() == null || definition.getStages().isEmpty()) {
            throw new PipelineDefinitionException("Pipeline '" + definition.getName() + "' declares no stages");
        }

        Pipeline.PipelineBuilder builder = Pipeline.builder().name(definition.getName());
        for (StageDefinition stageDefinition : definition.getStages()) {
            builder.stage(createStage(stageDefinition));
            if (stageDefinition.getType() == StageType.IMAGE_PUSH) {
                builder.credential(properties.getRegistryCredential());
            }
        }

        Pipeline pipeline = builder
                .postActions(PostActions.builder()
                        .onSuccess(this::notifyRun)
                        .onFailure(this::notifyRun)
                        .always((status, context) -> runCleanupService.cleanup(context))
                        .build())
                .build();

        log.debug("Pipeline {} created with stages {}", pipeline.getName(),
                pipeline.getStages().stream().map(Stage::name).toList());
        return pipeline;
    }

    public Stage createStage(StageDefinition definition) {
        if (definition.getName() == null || definition.getName().isBlank()) {
            throw new PipelineDefinitionException("Every stage needs a name");
        }
        if (definition.getType() == null) {
            throw new PipelineDefinitionException("Stage '" + definition.getName() + "' has no type");
        }
        return registry.getOrDefault(definition.getType(), d -> {
            throw new PipelineDefinitionException("Unknown stage type: " + d.getType());
        }).apply(definition);
    }

    private void notifyRun(RunStatus status, RunContext context) {
        if (!properties.getNotification().isEnabled()) {
            log.info("Notifications disabled; run {} ends without one", context.getRunId());
            return;
        }
        notifier.notify(payloadFactory.create(status, context, clock.instant()), context);
    }

    private static Stage stage(StageDefinition definition, StageWork work,
                               List<ResourceClaim> claims) {
        return Stage.builder()
                .name(definition.getName())
                .work(work)
                .timeout(definition.getTimeout())
                .claims(claims)
                .build();
    }
}
