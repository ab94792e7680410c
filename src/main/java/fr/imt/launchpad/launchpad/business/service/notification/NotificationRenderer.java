package fr.imt.launchpad.launchpad.business.service.notification;

import fr.imt.launchpad.launchpad.business.model.NotificationEvent;
import fr.imt.launchpad.launchpad.business.model.NotificationKind;
import fr.imt.launchpad.launchpad.business.model.NotificationPayload;
import fr.imt.launchpad.launchpad.business.model.RenderedNotification;
import org.springframework.stereotype.Component;

import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Renders a notification event with the fixed template of its kind. Pure function of the event.
 */
@Component
public class NotificationRenderer {

    private static final String SUCCESS_SUBJECT = "[Launchpad] SUCCESS: %s run %s";
    private static final String FAILURE_SUBJECT = "[Launchpad] FAILURE: %s run %s";

    private static final String SUCCESS_TEMPLATE = """
            Deployment of %s succeeded.

            Branch:     %s
            Revision:   %s
            Run:        %s
            Image:      %s
            Target URL: %s
            Build URL:  %s
            Finished:   %s

            Stages:
            %s
            """;

    private static final String FAILURE_TEMPLATE = """
            Pipeline for %s failed at stage "%s".

            Branch:     %s
            Revision:   %s
            Run:        %s
            Image:      %s
            Target URL: %s
            Build URL:  %s
            Finished:   %s

            Stages:
            %s

            Failure details:
            %s
            """;

    /**
     * @param redactor applied to the whole rendered text, so no resolved secret reaches a recipient
     */
    public RenderedNotification render(NotificationEvent event, UnaryOperator<String> redactor) {
        NotificationPayload payload = event.payload();
        String stages = payload.stages().stream()
                .map(stage -> String.format("  - %-28s %s", stage.name(), stage.status()))
                .collect(Collectors.joining("\n"));

        String subject;
        String body;
        if (event.kind() == NotificationKind.SUCCESS) {
            subject = SUCCESS_SUBJECT.formatted(payload.projectName(), payload.runId());
            body = SUCCESS_TEMPLATE.formatted(
                    payload.projectName(), payload.branch(), payload.revision(), payload.runId(),
                    payload.imageReference(), payload.targetUrl(), payload.buildUrl(), payload.timestamp(),
                    stages);
        } else {
            subject = FAILURE_SUBJECT.formatted(payload.projectName(), payload.runId());
            body = FAILURE_TEMPLATE.formatted(
                    payload.projectName(), valueOr(payload.failedStage(), "none"),
                    payload.branch(), payload.revision(), payload.runId(),
                    payload.imageReference(), payload.targetUrl(), payload.buildUrl(), payload.timestamp(),
                    stages, valueOr(payload.failureDetail(), "No stage failed; the run was cancelled."));
        }

        return new RenderedNotification(event.recipients(), redactor.apply(subject), redactor.apply(body));
    }

    private static String valueOr(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
