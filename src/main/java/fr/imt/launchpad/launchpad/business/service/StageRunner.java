package fr.imt.launchpad.launchpad.business.service;

import fr.imt.launchpad.launchpad.business.model.FailureKind;
import fr.imt.launchpad.launchpad.business.model.ProcessResult;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.model.Stage;
import fr.imt.launchpad.launchpad.business.model.StageOutcome;
import fr.imt.launchpad.launchpad.business.model.StageStatus;
import fr.imt.launchpad.launchpad.business.port.RunLogPublisherPort;
import fr.imt.launchpad.launchpad.business.utils.Constants;
import fr.imt.launchpad.launchpad.configuration.ExecutorConfiguration;
import fr.imt.launchpad.launchpad.configuration.LaunchpadProperties;
import fr.imt.launchpad.launchpad.exception.LaunchpadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Executes one stage on a worker thread and presents it synchronously to the orchestrator.
 * The caller blocks in short slices so that both the stage timeout and a run cancellation are noticed
 * while the work is in flight. Interrupted work gets a grace period to release what it acquired.
 */
@Service
@Slf4j
public class StageRunner {

    private final AsyncTaskExecutor stageExecutor;
    private final RunLogPublisherPort logPublisher;
    private final Duration checkInterval;
    private final Duration abortGracePeriod;

    @Autowired
    public StageRunner(@Qualifier(ExecutorConfiguration.STAGE_EXECUTOR) AsyncTaskExecutor stageExecutor,
                       RunLogPublisherPort logPublisher,
                       LaunchpadProperties properties) {
        this(stageExecutor, logPublisher,
                properties.getRunner().getCancellationCheckInterval(),
                properties.getRunner().getAbortGracePeriod());
    }

    public StageRunner(AsyncTaskExecutor stageExecutor, RunLogPublisherPort logPublisher,
                       Duration checkInterval, Duration abortGracePeriod) {
        this.stageExecutor = stageExecutor;
        this.logPublisher = logPublisher;
        this.checkInterval = checkInterval;
        this.abortGracePeriod = abortGracePeriod;
    }

    public StageOutcome execute(Stage stage, RunContext context) {
        Instant start = Instant.now();
        context.setCurrentStage(stage.name());
        publishLog(context, String.format("--- Stage [%s] Starting ---", stage.name()));
        if (!stage.claims().isEmpty()) {
            publishLog(context, "Acquires: " + stage.claims().stream()
                    .map(Object::toString)
                    .collect(Collectors.joining(", ")));
        }

        CountDownLatch released = new CountDownLatch(1);
        Future<ProcessResult> future;
        try {
            future = stageExecutor.submit(() -> {
                try {
                    return stage.work().execute(context);
                } finally {
                    released.countDown();
                }
            });
        } catch (TaskRejectedException e) {
            log.error("Stage {} could not be scheduled for run {}", stage.name(), context.getRunId(), e);
            return record(context, stage, start, FailureKind.ABORTED, null,
                    "", "Stage could not be scheduled: " + e.getMessage());
        }

        try {
            ProcessResult result = await(future, stage, context);
            if (result.isSuccess()) {
                return record(context, stage, start, null, result.exitCode(), result.output(), null);
            }
            return record(context, stage, start, FailureKind.WORK_FAILED, result.exitCode(), result.output(),
                    "Stage exited with code " + result.exitCode());

        } catch (TimeoutException e) {
            abort(future, released, stage);
            return record(context, stage, start, FailureKind.TIMEOUT, null, "",
                    "Stage exceeded its timeout of " + stage.timeout());

        } catch (RunCancelledException e) {
            abort(future, released, stage);
            return record(context, stage, start, FailureKind.ABORTED, null, "",
                    "Run cancelled while the stage was running");

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            FailureKind kind = cause instanceof LaunchpadException launchpadException
                    ? launchpadException.getFailureKind()
                    : FailureKind.ABORTED;
            log.warn("Stage {} of run {} threw {}", stage.name(), context.getRunId(), cause.toString());
            return record(context, stage, start, kind, null, String.valueOf(cause.getMessage()),
                    cause.getClass().getSimpleName() + ": " + cause.getMessage());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort(future, released, stage);
            return record(context, stage, start, FailureKind.ABORTED, null, "",
                    "Stage runner interrupted");
        }
    }

    private ProcessResult await(Future<ProcessResult> future, Stage stage, RunContext context)
            throws TimeoutException, ExecutionException, InterruptedException, RunCancelledException {
        Long deadline = stage.timeoutOpt()
                .map(timeout -> System.nanoTime() + timeout.toNanos())
                .orElse(null);

        while (true) {
            if (context.isCancelled()) {
                throw new RunCancelledException();
            }
            long slice = checkInterval.toNanos();
            if (deadline != null) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    throw new TimeoutException();
                }
                slice = Math.min(slice, remaining);
            }
            try {
                return future.get(slice, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                // not done within this slice
            }
        }
    }

    private void abort(Future<ProcessResult> future, CountDownLatch released, Stage stage) {
        future.cancel(true);
        try {
            if (!released.await(abortGracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Stage {} did not finish releasing its resources within {}", stage.name(), abortGracePeriod);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for stage {} to release its resources", stage.name());
        }
    }

    private StageOutcome record(RunContext context, Stage stage, Instant start, FailureKind kind,
                                Integer exitCode, String output, String message) {
        Duration duration = Duration.between(start, Instant.now());
        String redactedOutput = Constants.tail(context.redact(output == null ? "" : output), Constants.MAX_CAPTURED_OUTPUT);

        StageOutcome outcome = StageOutcome.builder()
                .stageName(stage.name())
                .status(kind == null ? StageStatus.SUCCEEDED : StageStatus.FAILED)
                .failureKind(kind)
                .exitCode(exitCode)
                .output(redactedOutput)
                .message(context.redact(message))
                .startedAt(start)
                .duration(duration)
                .build();
        context.recordOutcome(outcome);

        if (kind == null) {
            log.info("Stage {} of run {} succeeded in {} ms", stage.name(), context.getRunId(), duration.toMillis());
        } else {
            log.warn("Stage {} of run {} failed ({}): {}", stage.name(), context.getRunId(), kind, outcome.message());
        }
        publishLog(context, String.format("--- Stage [%s] Finished (%s%s) ---",
                stage.name(), outcome.status(), kind == null ? "" : ", " + kind));
        return outcome;
    }

    private void publishLog(RunContext context, String message) {
        logPublisher.publish(context.getRunId(), context.redact(message));
    }

    private static final class RunCancelledException extends Exception {
    }
}
