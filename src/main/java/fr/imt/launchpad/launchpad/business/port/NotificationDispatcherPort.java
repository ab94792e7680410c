package fr.imt.launchpad.launchpad.business.port;

import fr.imt.launchpad.launchpad.business.model.RenderedNotification;

public interface NotificationDispatcherPort {
    void dispatch(RenderedNotification notification);
}
