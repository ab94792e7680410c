package fr.imt.launchpad.launchpad.infrastructure.logging;

import fr.imt.launchpad.launchpad.business.port.RunStatusPublisherPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "launchpad.redis.enabled", havingValue = "false", matchIfMissing = true)
@Slf4j
public class Slf4jRunStatusPublisherAdapter implements RunStatusPublisherPort {

    @Override
    public void publish(String runId, String status, String currentStage) {
        if (currentStage != null) {
            log.info("[{}] {} ({})", runId, status, currentStage);
        } else {
            log.info("[{}] {}", runId, status);
        }
    }
}
