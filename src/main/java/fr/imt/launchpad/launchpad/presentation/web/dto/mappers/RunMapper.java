package fr.imt.launchpad.launchpad.presentation.web.dto.mappers;

import fr.imt.launchpad.launchpad.business.model.RunRecord;
import fr.imt.launchpad.launchpad.business.model.RunRequest;
import fr.imt.launchpad.launchpad.business.model.RunWarning;
import fr.imt.launchpad.launchpad.business.model.StageOutcome;
import fr.imt.launchpad.launchpad.presentation.web.dto.RunRequestBody;
import fr.imt.launchpad.launchpad.presentation.web.dto.RunResponse;
import fr.imt.launchpad.launchpad.presentation.web.dto.StageResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.time.Duration;
import java.util.List;

@Mapper(componentModel = "spring")
public interface RunMapper {

    String IN_PROGRESS = "RUNNING";

    RunRequest toRequest(RunRequestBody body);

    @Mapping(target = "name", source = "stageName")
    @Mapping(target = "durationMs", source = "duration")
    StageResponse toResponse(StageOutcome outcome);

    List<StageResponse> toStageResponses(List<StageOutcome> outcomes);

    @Mapping(target = "runId", source = "context.runId")
    @Mapping(target = "branch", source = "context.branch")
    @Mapping(target = "revision", source = "context.revision")
    @Mapping(target = "buildUrl", source = "context.buildUrl")
    @Mapping(target = "startedAt", source = "context.startedAt")
    @Mapping(target = "currentStage", source = "context.currentStage")
    @Mapping(target = "durationMs", source = "outcome.duration")
    @Mapping(target = "hooksRun", source = "outcome.hooksRun")
    @Mapping(target = "status", expression = "java(statusOf(run))")
    @Mapping(target = "stages", expression = "java(toStageResponses(run.isFinished() ? run.outcome().stages() : run.context().getOutcomes()))")
    @Mapping(target = "warnings", expression = "java(warningsOf(run))")
    RunResponse toResponse(RunRecord run);

    default String statusOf(RunRecord run) {
        return run.isFinished() ? run.outcome().status().name() : IN_PROGRESS;
    }

    default List<String> warningsOf(RunRecord run) {
        List<RunWarning> warnings = run.isFinished() ? run.outcome().warnings() : run.context().getWarnings();
        return warnings.stream()
                .map(warning -> warning.code() + ": " + warning.message())
                .toList();
    }

    default Long toMillis(Duration duration) {
        return duration != null ? duration.toMillis() : null;
    }
}
