package fr.imt.launchpad.launchpad.business.service.notification;

import fr.imt.launchpad.launchpad.business.model.NotificationEvent;
import fr.imt.launchpad.launchpad.business.model.RenderedNotification;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.model.RunWarning;
import fr.imt.launchpad.launchpad.business.port.NotificationDispatcherPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Renders and dispatches run notifications. Never throws: a dispatch failure becomes a run warning.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Notifier {

    private final NotificationRenderer renderer;
    private final NotificationDispatcherPort dispatcher;

    /**
     * @return true if the notification was handed to the transport
     */
    public boolean notify(NotificationEvent event, RunContext context) {
        String runId = context.getRunId();
        try {
            RenderedNotification rendered = renderer.render(event, context::redact);
            if (rendered.recipients().isEmpty()) {
                log.info("No notification recipients configured; skipping {} notification for run {}", event.kind(), runId);
                return false;
            }
            dispatcher.dispatch(rendered);
            log.info("{} notification for run {} sent to {}", event.kind(), runId, rendered.recipients());
            return true;
        } catch (Exception e) {
            log.warn("{} notification for run {} could not be dispatched", event.kind(), runId, e);
            context.addWarning(RunWarning.NOTIFICATION_DISPATCH_FAILED,
                    event.kind() + " notification not sent: " + e.getMessage());
            return false;
        }
    }
}
