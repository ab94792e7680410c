package fr.imt.launchpad.launchpad.infrastructure.redis;

import fr.imt.launchpad.launchpad.business.port.RunStatusPublisherPort;
import fr.imt.launchpad.launchpad.configuration.RedisConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "launchpad.redis.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class RedisRunStatusPublisherAdapter implements RunStatusPublisherPort {

    private final StringRedisTemplate redisTemplate;

    @Override
    public void publish(String runId, String status, String currentStage) {
        try {
            String message = String.format("%s|%s|%s",
                    runId,
                    status,
                    currentStage != null ? currentStage : "");
            redisTemplate.convertAndSend(RedisConfiguration.PIPELINE_STATUS_TOPIC, message);
        } catch (Exception e) {
            log.error("Failed to publish status for run {}", runId, e);
        }
    }
}
