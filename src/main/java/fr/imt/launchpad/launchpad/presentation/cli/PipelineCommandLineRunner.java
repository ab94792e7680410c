package fr.imt.launchpad.launchpad.presentation.cli;

import fr.imt.launchpad.launchpad.business.model.RunOutcome;
import fr.imt.launchpad.launchpad.business.model.RunRequest;
import fr.imt.launchpad.launchpad.business.model.RunWarning;
import fr.imt.launchpad.launchpad.business.model.StageOutcome;
import fr.imt.launchpad.launchpad.business.service.PipelineRunService;
import fr.imt.launchpad.launchpad.business.utils.Constants;
import fr.imt.launchpad.launchpad.exception.LaunchpadException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Runs the configured pipeline once, prints a summary and exposes the exit code: 0 on success, 1 otherwise.
 */
@Component
@ConditionalOnProperty(name = "launchpad.cli.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class PipelineCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int FAILURE_OUTPUT_LENGTH = 4000;

    private final PipelineRunService pipelineRunService;
    private PrintStream out = System.out;
    private int exitCode = 1;

    @Override
    public void run(ApplicationArguments args) {
        RunRequest request = RunRequest.builder()
                .runId(option(args, "run-id"))
                .branch(option(args, "branch"))
                .revision(option(args, "revision"))
                .buildUrl(option(args, "build-url"))
                .build();

        try {
            RunOutcome outcome = pipelineRunService.runAndWait(request);
            print(outcome);
            exitCode = outcome.exitCode();
        } catch (LaunchpadException e) {
            log.error("Run could not start [{}]: {}", e.getErrorCode(), e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    void print(RunOutcome outcome) {
        out.printf("Run %s: %s in %d ms%n", outcome.runId(), outcome.status(), outcome.duration().toMillis());
        out.printf("%-28s %-10s %-30s %s%n", "STAGE", "STATUS", "FAILURE", "DURATION");
        for (StageOutcome stage : outcome.stages()) {
            out.printf("%-28s %-10s %-30s %d ms%n",
                    stage.stageName(),
                    stage.status(),
                    stage.failureKind() != null ? stage.failureKind() : "",
                    stage.duration() != null ? stage.duration().toMillis() : 0);
        }
        outcome.failedStage().ifPresent(this::printFailure);

        List<RunWarning> warnings = outcome.warnings();
        if (!warnings.isEmpty()) {
            out.println();
            warnings.forEach(warning -> out.printf("WARNING %s: %s%n", warning.code(), warning.message()));
        }
    }

    private void printFailure(StageOutcome stage) {
        out.printf("%nFailed stage %s: %s%n", stage.stageName(),
                stage.message() != null ? stage.message() : stage.failureKind());
        if (stage.output() != null && !stage.output().isBlank()) {
            out.printf("Last output of %s:%n%s%n", stage.stageName(),
                    Constants.tail(stage.output().stripTrailing(), FAILURE_OUTPUT_LENGTH));
        }
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
