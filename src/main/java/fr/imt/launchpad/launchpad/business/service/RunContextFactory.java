package fr.imt.launchpad.launchpad.business.service;

import fr.imt.launchpad.launchpad.business.model.ImageReference;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.model.RunRequest;
import fr.imt.launchpad.launchpad.business.utils.TagSanitizer;
import fr.imt.launchpad.launchpad.configuration.LaunchpadProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds a run context from explicit inputs, falling back to local defaults for anything missing.
 * Default run ids carry a counter so local runs started in the same second stay distinct.
 */
@Component
@RequiredArgsConstructor
public class RunContextFactory {

    static final String LOCAL_BRANCH = "local";
    static final String UNKNOWN_REVISION = "unknown";
    static final String NO_BUILD_URL = "n/a";

    private final AtomicInteger localRuns = new AtomicInteger();
    private final LaunchpadProperties properties;
    private final Clock clock;

    public RunContext create(RunRequest request) {
        Instant now = clock.instant();
        String runId = TagSanitizer.sanitizeTag(isBlank(request.runId())
                ? "local-" + now.getEpochSecond() + "-" + localRuns.incrementAndGet()
                : request.runId());

        String floatingTag = properties.getImage().getFloatingTag();
        List<String> tags = runId.equals(floatingTag) ? List.of(runId) : List.of(runId, floatingTag);
        ImageReference plannedImage = new ImageReference(
                properties.getImage().getRegistry(), properties.getImage().getRepository(), tags);

        return RunContext.builder()
                .runId(runId)
                .projectName(properties.getProjectName())
                .branch(isBlank(request.branch()) ? LOCAL_BRANCH : request.branch())
                .revision(isBlank(request.revision()) ? UNKNOWN_REVISION : request.revision())
                .buildUrl(isBlank(request.buildUrl()) ? defaultBuildUrl(runId) : request.buildUrl())
                .startedAt(now)
                .environment(request.environment())
                .plannedImage(plannedImage)
                .build();
    }

    private String defaultBuildUrl(String runId) {
        String template = properties.getBuildUrlTemplate();
        return isBlank(template) ? NO_BUILD_URL : template.replace("{runId}", runId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
