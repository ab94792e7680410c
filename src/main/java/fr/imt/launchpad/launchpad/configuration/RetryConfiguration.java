package fr.imt.launchpad.launchpad.configuration;

import fr.imt.launchpad.launchpad.exception.DockerOperationException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

@Configuration
public class RetryConfiguration {

    /**
     * Retries daemon errors on container lifecycle calls. Missing containers never reach it.
     */
    @Bean
    public RetryTemplate dockerRetryTemplate() {
        return RetryTemplate.builder()
                .maxAttempts(3)
                .exponentialBackoff(1000, 2, 10000)
                .retryOn(DockerOperationException.class)
                .build();
    }
}
