package fr.imt.launchpad.launchpad.presentation.web.dto;

import lombok.Data;

@Data
public class StageResponse {
    private String name;
    private String status;
    private String failureKind;
    private Integer exitCode;
    private String message;
    private Long durationMs;
}
