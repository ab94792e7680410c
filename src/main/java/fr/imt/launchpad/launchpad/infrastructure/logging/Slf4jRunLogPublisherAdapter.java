package fr.imt.launchpad.launchpad.infrastructure.logging;

import fr.imt.launchpad.launchpad.business.port.RunLogPublisherPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Writes the run log to the application log when no Redis channel is configured.
 */
@Component
@ConditionalOnProperty(name = "launchpad.redis.enabled", havingValue = "false", matchIfMissing = true)
@Slf4j
public class Slf4jRunLogPublisherAdapter implements RunLogPublisherPort {

    @Override
    public void publish(String runId, String message) {
        log.info("[{}] {}", runId, message);
    }
}
