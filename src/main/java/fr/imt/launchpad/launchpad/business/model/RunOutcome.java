package fr.imt.launchpad.launchpad.business.model;

import lombok.Builder;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

@Builder
public record RunOutcome(
        String runId,
        RunStatus status,
        List<StageOutcome> stages,
        Duration duration,
        List<HookType> hooksRun,
        List<RunWarning> warnings) {

    public RunOutcome {
        stages = List.copyOf(stages);
        hooksRun = List.copyOf(hooksRun);
        warnings = List.copyOf(warnings);
    }

    public int exitCode() {
        return status == RunStatus.SUCCESS ? 0 : 1;
    }

    public Optional<StageOutcome> failedStage() {
        return stages.stream()
                .filter(stage -> stage.status() == StageStatus.FAILED)
                .findFirst();
    }
}
