package fr.imt.launchpad.launchpad.business.model;

import java.util.List;

public record NotificationEvent(NotificationKind kind, NotificationPayload payload, List<String> recipients) {

    public NotificationEvent {
        recipients = List.copyOf(recipients);
    }
}
