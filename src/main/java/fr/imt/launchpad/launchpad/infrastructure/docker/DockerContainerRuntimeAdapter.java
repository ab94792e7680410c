package fr.imt.launchpad.launchpad.infrastructure.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.BuildImageResultCallback;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.AuthConfig;
import com.github.dockerjava.api.model.BuildResponseItem;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.PortBinding;
import com.github.dockerjava.api.model.Ports;
import com.github.dockerjava.api.model.PruneResponse;
import com.github.dockerjava.api.model.PruneType;
import fr.imt.launchpad.launchpad.business.model.ContainerSpec;
import fr.imt.launchpad.launchpad.business.model.Credential;
import fr.imt.launchpad.launchpad.business.port.ContainerRuntimePort;
import fr.imt.launchpad.launchpad.business.port.RegistrySession;
import fr.imt.launchpad.launchpad.business.port.RunLogPublisherPort;
import fr.imt.launchpad.launchpad.exception.DockerOperationException;
import fr.imt.launchpad.launchpad.exception.ImageBuildException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static fr.imt.launchpad.launchpad.business.utils.Constants.MANAGED_LABEL;
import static fr.imt.launchpad.launchpad.business.utils.Constants.RUN_LABEL;

/**
 * Container runtime backed by the local Docker daemon.
 * Containers are addressed by name and tagged with ownership labels so a run can find what it created.
 */
@Component
@Slf4j
public class DockerContainerRuntimeAdapter implements ContainerRuntimePort {

    static final String DOCKER_HUB_ADDRESS = "https://index.docker.io/v1/";
    private static final int STOP_TIMEOUT_SECONDS = 10;
    private static final long PULL_TIMEOUT_MINUTES = 5;
    private static final long LOGS_TIMEOUT_SECONDS = 30;

    private final DockerClient dockerClient;
    private final RetryTemplate dockerRetryTemplate;
    private final RunLogPublisherPort logPublisher;
    private final int timeoutSeconds;
    private final long memoryLimit;

    public DockerContainerRuntimeAdapter(DockerClient dockerClient,
                                         @Qualifier("dockerRetryTemplate") RetryTemplate dockerRetryTemplate,
                                         RunLogPublisherPort logPublisher,
                                         @Value("${docker.timeout.seconds:600}") int timeoutSeconds,
                                         @Value("${docker.memory.limit:2147483648}") long memoryLimit) {
        this.dockerClient = dockerClient;
        this.dockerRetryTemplate = dockerRetryTemplate;
        this.logPublisher = logPublisher;
        this.timeoutSeconds = timeoutSeconds;
        this.memoryLimit = memoryLimit;
    }

    // --- Images ---

    @Override
    @Retryable(
        retryFor = DockerException.class,
        maxAttempts = 3,
        backoff = @Backoff(delay = 2000, multiplier = 2)
    )
    public String buildImage(String runId, Path buildContext, String dockerfile) {
        File baseDirectory = buildContext.toFile();
        return dockerClient.buildImageCmd(baseDirectory)
                .withDockerfile(new File(baseDirectory, dockerfile))
                .withLabels(Map.of(MANAGED_LABEL, "true", RUN_LABEL, runId))
                .exec(new BuildImageResultCallback() {
                    @Override
                    public void onNext(BuildResponseItem item) {
                        if (item.getStream() != null && !item.getStream().isBlank()) {
                            logPublisher.publish(runId, item.getStream().trim());
                        }
                        super.onNext(item);
                    }
                })
                .awaitImageId();
    }

    @Override
    public void tagImage(String imageId, String imageName, String tag) {
        try {
            dockerClient.tagImageCmd(imageId, imageName, tag).withForce(true).exec();
        } catch (DockerException e) {
            throw new ImageBuildException(imageName + ":" + tag, "tag", e);
        }
    }

    @Override
    public void removeTag(String reference) {
        try {
            dockerClient.removeImageCmd(reference).withNoPrune(true).exec();
        } catch (NotFoundException e) {
            log.debug("Tag {} already gone", reference);
        }
    }

    @Override
    public RegistrySession openRegistrySession(String registry, Credential credential) {
        AuthConfig authConfig = new AuthConfig()
                .withUsername(credential.username())
                .withPassword(credential.password())
                .withRegistryAddress(registryAddress(registry));
        try {
            dockerClient.authCmd().withAuthConfig(authConfig).exec();
        } catch (DockerException e) {
            // The daemon error can echo the request; keep only the status.
            throw new DockerOperationException("Registry login to " + registry + " as " + credential.id()
                    + " failed (HTTP " + e.getHttpStatus() + ")");
        }
        log.info("Registry session opened on {} as {}", registry, credential.id());
        return new DockerRegistrySession(dockerClient, authConfig, timeoutSeconds);
    }

    @Override
    public void pruneDanglingImages() {
        PruneResponse response = dockerClient.pruneCmd(PruneType.IMAGES).withDangling(true).exec();
        log.info("Pruned dangling images, reclaimed {} bytes", response.getSpaceReclaimed());
    }

    // --- Containers ---

    @Override
    public String runContainer(ContainerSpec spec) {
        pullImageIfNeeded(spec.image());

        ExposedPort exposedPort = ExposedPort.tcp(spec.containerPort());
        HostConfig hostConfig = HostConfig.newHostConfig()
                .withPortBindings(new PortBinding(Ports.Binding.bindPort(spec.hostPort()), exposedPort))
                .withMemory(memoryLimit)
                .withAutoRemove(false);

        String[] env = spec.env().entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .toArray(String[]::new);

        CreateContainerResponse container;
        try {
            container = dockerClient.createContainerCmd(spec.image())
                    .withName(spec.name())
                    .withLabels(spec.labels())
                    .withEnv(env)
                    .withExposedPorts(exposedPort)
                    .withHostConfig(hostConfig)
                    .exec();
        } catch (DockerException e) {
            throw new DockerOperationException("create container " + spec.name(), e);
        }

        try {
            dockerClient.startContainerCmd(container.getId()).exec();
        } catch (DockerException e) {
            log.warn("Container {} created but failed to start; removing it", spec.name());
            removeQuietly(container.getId());
            throw new DockerOperationException("start container " + spec.name(), e);
        }
        return container.getId();
    }

    @Override
    public boolean stopAndRemoveContainer(String name) {
        return dockerRetryTemplate.execute(retryContext -> {
            if (inspect(name).isEmpty()) {
                return false;
            }
            try {
                dockerClient.stopContainerCmd(name).withTimeout(STOP_TIMEOUT_SECONDS).exec();
            } catch (NotModifiedException e) {
                log.debug("Container {} was already stopped", name);
            } catch (NotFoundException e) {
                return false;
            } catch (DockerException e) {
                throw new DockerOperationException("stop container " + name, e);
            }

            try {
                dockerClient.removeContainerCmd(name).withForce(true).exec();
                return true;
            } catch (NotFoundException e) {
                return true;
            } catch (DockerException e) {
                throw new DockerOperationException("remove container " + name, e);
            }
        });
    }

    @Override
    public String containerLogs(String name, int tailLines) {
        StringBuilder output = new StringBuilder();
        try {
            dockerClient.logContainerCmd(name)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withTail(tailLines)
                    .exec(new ResultCallback.Adapter<Frame>() {
                        @Override
                        public void onNext(Frame frame) {
                            output.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                        }
                    })
                    .awaitCompletion(LOGS_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Reading logs of container {} interrupted", name);
        } catch (NotFoundException e) {
            return "";
        }
        return output.toString();
    }

    @Override
    public List<String> listRunContainers(String runId) {
        return dockerClient.listContainersCmd()
                .withShowAll(true)
                .withLabelFilter(Map.of(
                        MANAGED_LABEL, "true",
                        RUN_LABEL, runId
                ))
                .exec()
                .stream()
                .map(DockerContainerRuntimeAdapter::nameOf)
                .toList();
    }

    private Optional<InspectContainerResponse> inspect(String name) {
        try {
            return Optional.of(dockerClient.inspectContainerCmd(name).exec());
        } catch (NotFoundException e) {
            return Optional.empty();
        } catch (DockerException e) {
            throw new DockerOperationException("inspect container " + name, e);
        }
    }

    private void pullImageIfNeeded(String image) {
        try {
            dockerClient.inspectImageCmd(image).exec();
            return;
        } catch (NotFoundException e) {
            log.info("Image {} not present locally, pulling it", image);
        }

        try {
            boolean completed = dockerClient.pullImageCmd(image)
                    .start()
                    .awaitCompletion(PULL_TIMEOUT_MINUTES, TimeUnit.MINUTES);
            if (!completed) {
                throw new DockerOperationException("Pulling " + image + " did not finish within "
                        + PULL_TIMEOUT_MINUTES + " minutes");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DockerOperationException("pull image " + image, e);
        } catch (DockerException e) {
            throw new DockerOperationException("pull image " + image, e);
        }
    }

    private void removeQuietly(String containerId) {
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
        } catch (DockerException e) {
            log.warn("Failed to remove container {}", containerId, e);
        }
    }

    private static String nameOf(Container container) {
        String[] names = container.getNames();
        if (names == null || names.length == 0) {
            return container.getId();
        }
        return Arrays.stream(names)
                .findFirst()
                .map(name -> name.startsWith("/") ? name.substring(1) : name)
                .orElse(container.getId());
    }

    static String registryAddress(String registry) {
        if (registry == null || registry.isBlank() || "docker.io".equals(registry) || "index.docker.io".equals(registry)) {
            return DOCKER_HUB_ADDRESS;
        }
        return registry;
    }
}
