package fr.imt.launchpad.launchpad.infrastructure.mail;

import fr.imt.launchpad.launchpad.business.model.RenderedNotification;
import fr.imt.launchpad.launchpad.business.port.NotificationDispatcherPort;
import fr.imt.launchpad.launchpad.configuration.LaunchpadProperties;
import fr.imt.launchpad.launchpad.exception.NotificationDispatchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class MailNotificationDispatcherAdapter implements NotificationDispatcherPort {

    private final JavaMailSender mailSender;
    private final LaunchpadProperties properties;

    @Override
    public void dispatch(RenderedNotification notification) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(properties.getNotification().getFrom());
        message.setTo(notification.recipients().toArray(String[]::new));
        message.setSubject(notification.subject());
        message.setText(notification.body());

        try {
            mailSender.send(message);
        } catch (MailException e) {
            throw new NotificationDispatchException("Mail relay refused \"" + notification.subject() + "\": "
                    + e.getMessage(), e);
        }
        log.debug("Mail \"{}\" handed to the relay", notification.subject());
    }
}
