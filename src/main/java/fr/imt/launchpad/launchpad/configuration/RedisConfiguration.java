package fr.imt.launchpad.launchpad.configuration;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@ConditionalOnProperty(name = "launchpad.redis.enabled", havingValue = "true")
public class RedisConfiguration {

    public static final String LOGS_TOPIC = "pipeline-logs";
    public static final String PIPELINE_STATUS_TOPIC = "pipeline-status";

    @Bean
    StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }
}
