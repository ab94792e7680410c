package fr.imt.launchpad.launchpad.business.service;

import fr.imt.launchpad.launchpad.business.model.Pipeline;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.model.RunOutcome;
import fr.imt.launchpad.launchpad.business.model.RunRecord;
import fr.imt.launchpad.launchpad.business.port.RunHistoryPort;
import fr.imt.launchpad.launchpad.configuration.ExecutorConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Runs a pipeline on the run executor and records the outcome in the history.
 * Kept apart from {@link PipelineRunService} so that the {@code @Async} proxy applies.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AsyncRunExecutor {

    private final PipelineOrchestrator orchestrator;
    private final RunHistoryPort runHistory;

    @Async(ExecutorConfiguration.RUN_EXECUTOR)
    public CompletableFuture<RunOutcome> execute(Pipeline pipeline, RunContext context) {
        try {
            RunOutcome outcome = orchestrator.run(pipeline, context);
            runHistory.save(RunRecord.started(context).finish(outcome));
            return CompletableFuture.completedFuture(outcome);
        } catch (RuntimeException e) {
            log.error("Run {} aborted unexpectedly", context.getRunId(), e);
            return CompletableFuture.failedFuture(e);
        }
    }
}
