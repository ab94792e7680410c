package fr.imt.launchpad.launchpad.business.service;

import fr.imt.launchpad.launchpad.business.model.Pipeline;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.model.RunOutcome;
import fr.imt.launchpad.launchpad.business.model.RunRecord;
import fr.imt.launchpad.launchpad.business.model.RunRequest;
import fr.imt.launchpad.launchpad.business.port.CredentialStore;
import fr.imt.launchpad.launchpad.business.port.RunHistoryPort;
import fr.imt.launchpad.launchpad.business.port.RunStatusPublisherPort;
import fr.imt.launchpad.launchpad.exception.CredentialNotFoundException;
import fr.imt.launchpad.launchpad.exception.RunNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point shared by the CLI and the REST API: creates runs, starts them and answers status queries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineRunService {

    private final PipelineFactory pipelineFactory;
    private final RunContextFactory runContextFactory;
    private final PipelineOrchestrator orchestrator;
    private final AsyncRunExecutor asyncRunExecutor;
    private final RunHistoryPort runHistory;
    private final RunStatusPublisherPort statusPublisher;
    private final CredentialStore credentialStore;

    /**
     * Create a run and start it in the background.
     *
     * @return the context of the run, readable while it progresses
     * @throws IllegalArgumentException when a run with the same id is still in progress
     */
    public RunContext start(RunRequest request) {
        Pipeline pipeline = pipelineFactory.create();
        RunContext context = register(request, pipeline);

        asyncRunExecutor.execute(pipeline, context);
        return context;
    }

    /**
     * Run the pipeline on the calling thread.
     */
    public RunOutcome runAndWait(RunRequest request) {
        Pipeline pipeline = pipelineFactory.create();
        RunContext context = register(request, pipeline);

        RunOutcome outcome = orchestrator.run(pipeline, context);
        runHistory.save(RunRecord.started(context).finish(outcome));
        return outcome;
    }

    public RunRecord find(String runId) {
        return runHistory.findById(runId)
                .orElseThrow(() -> new RunNotFoundException(runId));
    }

    /**
     * Ask a run to stop. The current stage is interrupted and the remaining ones are skipped.
     */
    public RunRecord cancel(String runId) {
        RunRecord record = find(runId);
        if (record.isFinished()) {
            log.info("Run {} already finished; nothing to cancel", runId);
            return record;
        }
        log.warn("Cancellation requested for run {}", runId);
        record.context().cancel();
        return record;
    }

    private RunContext register(RunRequest request, Pipeline pipeline) {
        RunContext context = runContextFactory.create(request);
        runHistory.findById(context.getRunId())
                .filter(existing -> !existing.isFinished())
                .ifPresent(existing -> {
                    throw new IllegalArgumentException("Run " + existing.runId() + " is already in progress");
                });

        preloadCredentials(pipeline, context);
        runHistory.save(RunRecord.started(context));
        statusPublisher.publish(context.getRunId(), "CREATED", null);
        log.info("Run {} created for {} at {}", context.getRunId(), context.getBranch(), context.getRevision());
        return context;
    }

    /**
     * Resolve the credentials the stages will use so their values are masked from the first stage on.
     * A missing one is left for the stage that needs it to report.
     */
    private void preloadCredentials(Pipeline pipeline, RunContext context) {
        for (String name : pipeline.getCredentials()) {
            try {
                context.registerCredential(credentialStore.resolve(name));
            } catch (CredentialNotFoundException e) {
                log.warn("Credential {} is not available for run {}; the stage using it will fail", name,
                        context.getRunId());
            }
        }
    }
}
