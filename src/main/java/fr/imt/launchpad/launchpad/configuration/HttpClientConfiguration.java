package fr.imt.launchpad.launchpad.configuration;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpClientConfiguration {

    @Bean
    public RestTemplate livenessRestTemplate(RestTemplateBuilder builder, LaunchpadProperties properties) {
        return builder
                .setConnectTimeout(properties.getHealth().getProbeTimeout())
                .setReadTimeout(properties.getHealth().getProbeTimeout())
                .build();
    }
}
