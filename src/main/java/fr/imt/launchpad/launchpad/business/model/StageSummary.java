package fr.imt.launchpad.launchpad.business.model;

public record StageSummary(String name, StageStatus status) {
}
