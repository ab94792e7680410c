package fr.imt.launchpad.launchpad.business.service;

import fr.imt.launchpad.launchpad.business.model.HookType;
import fr.imt.launchpad.launchpad.business.model.Pipeline;
import fr.imt.launchpad.launchpad.business.model.PostAction;
import fr.imt.launchpad.launchpad.business.model.PostActions;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.model.RunOutcome;
import fr.imt.launchpad.launchpad.business.model.RunStatus;
import fr.imt.launchpad.launchpad.business.model.RunWarning;
import fr.imt.launchpad.launchpad.business.model.Stage;
import fr.imt.launchpad.launchpad.business.model.StageOutcome;
import fr.imt.launchpad.launchpad.business.port.RunStatusPublisherPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the stages of a pipeline in declaration order and stops at the first failure.
 * Afterwards exactly one of the success or failure hooks runs, then the always hook, whatever happened before.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PipelineOrchestrator {

    private final StageRunner stageRunner;
    private final RunStatusPublisherPort statusPublisher;

    public RunOutcome run(Pipeline pipeline, RunContext context) {
        Instant start = Instant.now();
        String runId = context.getRunId();

        log.info("Pipeline {} run {} started ({} stages)", pipeline.getName(), runId, pipeline.getStages().size());
        statusPublisher.publish(runId, "RUNNING", null);

        boolean chainBroken = false;

        for (Stage stage : pipeline.getStages()) {
            if (chainBroken) {
                context.recordOutcome(StageOutcome.skipped(stage.name()));
                continue;
            }

            if (context.isCancelled()) {
                log.warn("Run {} cancelled before stage {}", runId, stage.name());
                context.addWarning(RunWarning.RUN_CANCELLED, "Run cancelled before stage " + stage.name());
                context.recordOutcome(StageOutcome.skipped(stage.name()));
                chainBroken = true;
                continue;
            }

            statusPublisher.publish(runId, "RUNNING", stage.name());
            StageOutcome outcome = stageRunner.execute(stage, context);

            if (!outcome.isSucceeded()) {
                log.warn("Run {} halted at stage {} ({})", runId, stage.name(), outcome.failureKind());
                chainBroken = true;
            }
        }
        context.setCurrentStage(null);

        RunStatus status = chainBroken ? RunStatus.FAILURE : RunStatus.SUCCESS;
        List<HookType> hooksRun = new ArrayList<>();
        PostActions postActions = pipeline.getPostActions();

        if (status == RunStatus.SUCCESS) {
            runHook(HookType.SUCCESS, postActions.onSuccess(), status, context, hooksRun);
        } else {
            runHook(HookType.FAILURE, postActions.onFailure(), status, context, hooksRun);
        }
        runHook(HookType.ALWAYS, postActions.always(), status, context, hooksRun);

        Duration duration = Duration.between(start, Instant.now());
        if (status == RunStatus.SUCCESS) {
            log.info("Pipeline {} run {} succeeded in {} ms", pipeline.getName(), runId, duration.toMillis());
        } else {
            log.warn("Pipeline {} run {} failed after {} ms", pipeline.getName(), runId, duration.toMillis());
        }
        statusPublisher.publish(runId, status == RunStatus.SUCCESS ? "SUCCESS" : "FAILED", null);

        return RunOutcome.builder()
                .runId(runId)
                .status(status)
                .stages(context.getOutcomes())
                .duration(duration)
                .hooksRun(hooksRun)
                .warnings(context.getWarnings())
                .build();
    }

    private void runHook(HookType type, PostAction action, RunStatus status, RunContext context, List<HookType> hooksRun) {
        hooksRun.add(type);
        try {
            action.run(status, context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} hook of run {} interrupted", type, context.getRunId());
            context.addWarning(RunWarning.HOOK_FAILED, type + " hook interrupted");
        } catch (Exception e) {
            log.error("{} hook of run {} failed", type, context.getRunId(), e);
            context.addWarning(RunWarning.HOOK_FAILED, type + " hook failed: " + e.getMessage());
        }
    }
}
