package fr.imt.launchpad.launchpad.business.model;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

@Builder
public record NotificationPayload(
        String projectName,
        String branch,
        String revision,
        String runId,
        String imageReference,
        String targetUrl,
        String buildUrl,
        Instant timestamp,
        RunStatus runStatus,
        List<StageSummary> stages,
        String failedStage,
        String failureDetail) {

    public NotificationPayload {
        stages = stages == null ? List.of() : List.copyOf(stages);
    }
}
