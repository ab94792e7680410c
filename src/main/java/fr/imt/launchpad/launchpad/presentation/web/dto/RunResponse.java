package fr.imt.launchpad.launchpad.presentation.web.dto;

import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
public class RunResponse {
    private String runId;
    private String status;
    private String branch;
    private String revision;
    private String buildUrl;
    private Instant startedAt;
    private String currentStage;
    private Long durationMs;
    private List<StageResponse> stages;
    private List<String> hooksRun;
    private List<String> warnings;
}
