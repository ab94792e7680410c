package fr.imt.launchpad.launchpad.business.service.image;

import fr.imt.launchpad.launchpad.business.model.Credential;
import fr.imt.launchpad.launchpad.business.model.ImageReference;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.port.ContainerRuntimePort;
import fr.imt.launchpad.launchpad.business.port.RegistrySession;
import fr.imt.launchpad.launchpad.business.port.RunLogPublisherPort;
import fr.imt.launchpad.launchpad.exception.ImageBuildException;
import fr.imt.launchpad.launchpad.exception.ImagePublishException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds images and publishes them to a registry.
 * A build applies all of its tags or none; a publish is not atomic across tags.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImageBuildService {

    private final ContainerRuntimePort containerRuntime;
    private final RunLogPublisherPort logPublisher;

    /**
     * Build an image from a directory and point every tag at it.
     *
     * @param context      Run the build belongs to
     * @param buildContext Build context directory
     * @param dockerfile   Dockerfile name, relative to the build context
     * @param registry     Registry host (e.g. "docker.io"), may be blank
     * @param repository   Repository name (e.g. "myuser/telco-churn")
     * @param tags         Tags to apply, run-specific tag first
     * @return The reference of the built image with all its tags
     * @throws ImageBuildException when the build fails or a tag cannot be applied
     */
    public ImageReference build(RunContext context, Path buildContext, String dockerfile,
                                String registry, String repository, List<String> tags) {
        ImageReference target = new ImageReference(registry, repository, tags);
        String runId = context.getRunId();

        if (!Files.isDirectory(buildContext)) {
            throw new ImageBuildException("Build context is not a directory: " + buildContext, null);
        }

        logPublisher.publish(runId, "Starting image build: " + target + " using " + dockerfile);
        log.info("Building image {} for run {}", target, runId);

        String imageId;
        try {
            imageId = containerRuntime.buildImage(runId, buildContext, dockerfile);
        } catch (ImageBuildException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Image build failed for run {}", runId, e);
            logPublisher.publish(runId, "Image build failed: " + e.getMessage());
            throw new ImageBuildException(target.primaryReference(), "build", e);
        }

        List<String> applied = new ArrayList<>();
        try {
            for (String tag : target.tags()) {
                containerRuntime.tagImage(imageId, target.name(), tag);
                applied.add(tag);
            }
        } catch (RuntimeException e) {
            log.error("Tagging image {} failed after {} of {} tags", imageId, applied.size(), target.tags().size(), e);
            untag(target, applied);
            throw new ImageBuildException(target.primaryReference(), "tag", e);
        }

        logPublisher.publish(runId, "Image built: " + imageId + " tagged " + target.tags());
        log.info("Image {} built as {}", target, imageId);
        return target;
    }

    /**
     * Push every tag of an image inside one authenticated session, closed on every exit path.
     * Tags pushed before a failure stay in the registry.
     *
     * @throws ImagePublishException on authentication or transfer error
     */
    public void publish(RunContext context, ImageReference image, Credential credential) {
        String runId = context.getRunId();
        List<String> pushed = new ArrayList<>();

        logPublisher.publish(runId, "Pushing image to registry: " + image + " as " + credential.id());

        try (RegistrySession session = containerRuntime.openRegistrySession(image.registry(), credential)) {
            for (String tag : image.tags()) {
                session.push(image.name(), tag);
                pushed.add(tag);
                logPublisher.publish(runId, "Pushed " + image.reference(tag));
            }
        } catch (ImagePublishException e) {
            throw e;
        } catch (RuntimeException e) {
            if (!pushed.isEmpty()) {
                log.warn("Publish of {} failed; tags {} remain in the registry", image.name(), pushed);
            }
            logPublisher.publish(runId, "Image push failed: " + e.getMessage());
            throw new ImagePublishException("Failed to publish " + image + " (pushed before failure: " + pushed + ")",
                    pushed, e);
        }

        log.info("Image {} published for run {}", image, runId);
    }

    private void untag(ImageReference target, List<String> applied) {
        for (String tag : applied) {
            try {
                containerRuntime.removeTag(target.reference(tag));
            } catch (RuntimeException e) {
                log.warn("Failed to remove tag {} after a failed build", target.reference(tag), e);
            }
        }
    }
}
