package fr.imt.launchpad.launchpad.business.service.notification;

import fr.imt.launchpad.launchpad.business.model.NotificationEvent;
import fr.imt.launchpad.launchpad.business.model.NotificationKind;
import fr.imt.launchpad.launchpad.business.model.NotificationPayload;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.model.RunStatus;
import fr.imt.launchpad.launchpad.business.model.StageOutcome;
import fr.imt.launchpad.launchpad.business.model.StageStatus;
import fr.imt.launchpad.launchpad.business.model.StageSummary;
import fr.imt.launchpad.launchpad.business.utils.Constants;
import fr.imt.launchpad.launchpad.configuration.LaunchpadProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Builds notification events from the state of a finished run. No I/O.
 */
@Component
@RequiredArgsConstructor
public class NotificationPayloadFactory {

    static final int FAILURE_DETAIL_LENGTH = 2000;

    private final LaunchpadProperties properties;

    public NotificationEvent create(RunStatus status, RunContext context, Instant timestamp) {
        Optional<StageOutcome> failed = context.getOutcomes().stream()
                .filter(outcome -> outcome.status() == StageStatus.FAILED)
                .findFirst();

        NotificationPayload payload = NotificationPayload.builder()
                .projectName(context.getProjectName())
                .branch(context.getBranch())
                .revision(context.getRevision())
                .runId(context.getRunId())
                .imageReference(context.currentImage().primaryReference())
                .targetUrl(targetUrl(context))
                .buildUrl(context.getBuildUrl())
                .timestamp(timestamp)
                .runStatus(status)
                .stages(context.getOutcomes().stream()
                        .map(outcome -> new StageSummary(outcome.stageName(), outcome.status()))
                        .toList())
                .failedStage(failed.map(StageOutcome::stageName).orElse(null))
                .failureDetail(failed.map(NotificationPayloadFactory::failureDetail).orElse(null))
                .build();

        return new NotificationEvent(NotificationKind.of(status), payload,
                properties.getNotification().getRecipients());
    }

    private String targetUrl(RunContext context) {
        LaunchpadProperties.Deployment deployment = properties.getDeployment();
        int port = context.getDeployment() != null ? context.getDeployment().hostPort() : deployment.getHostPort();
        return "http://" + deployment.getHost() + ":" + port;
    }

    private static String failureDetail(StageOutcome outcome) {
        StringBuilder detail = new StringBuilder();
        detail.append(outcome.failureKind());
        if (outcome.message() != null) {
            detail.append(": ").append(outcome.message());
        }
        if (outcome.output() != null && !outcome.output().isBlank()) {
            detail.append(System.lineSeparator()).append(Constants.tail(outcome.output(), FAILURE_DETAIL_LENGTH));
        }
        return detail.toString();
    }
}
