package fr.imt.launchpad.launchpad.infrastructure.redis;

import fr.imt.launchpad.launchpad.business.port.RunLogPublisherPort;
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
public class RedisRunLogPublisherAdapter implements RunLogPublisherPort {

    private final StringRedisTemplate redisTemplate;

    @Override
    public void publish(String runId, String message) {
        try {
            redisTemplate.convertAndSend(RedisConfiguration.LOGS_TOPIC, runId + "|" + message);
        } catch (Exception e) {
            log.error("Failed to publish log line for run {}", runId, e);
        }
    }
}
