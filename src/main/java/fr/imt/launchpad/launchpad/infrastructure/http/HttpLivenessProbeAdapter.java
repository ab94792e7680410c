package fr.imt.launchpad.launchpad.infrastructure.http;

import fr.imt.launchpad.launchpad.business.port.LivenessProbePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Component
@Slf4j
public class HttpLivenessProbeAdapter implements LivenessProbePort {

    private final RestTemplate restTemplate;

    public HttpLivenessProbeAdapter(@Qualifier("livenessRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * Any 2xx answer counts as live; errors, timeouts and refused connections do not.
     */
    @Override
    public boolean isLive(String url) {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(url, String.class);
            return response.getStatusCode().is2xxSuccessful();
        } catch (RestClientException e) {
            log.debug("GET {} failed: {}", url, e.getMessage());
            return false;
        }
    }
}
