package fr.imt.launchpad.launchpad.business.model;

import lombok.Builder;

import java.util.Map;

/**
 * Explicit run inputs. Null fields fall back to local defaults.
 */
@Builder
public record RunRequest(String runId, String branch, String revision, String buildUrl, Map<String, String> environment) {

    public static RunRequest local() {
        return RunRequest.builder().build();
    }
}
