package fr.imt.launchpad.launchpad.business.service.stages;

import fr.imt.launchpad.launchpad.business.model.ProcessResult;
import fr.imt.launchpad.launchpad.business.model.RunContext;
import fr.imt.launchpad.launchpad.business.model.StageWork;
import fr.imt.launchpad.launchpad.business.port.RunLogPublisherPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an operator command (training script, test suite...) as a child process.
 * The process is destroyed if the stage is interrupted.
 */
@RequiredArgsConstructor
@Slf4j
public class CommandStageWork implements StageWork {

    private static final long OUTPUT_DRAIN_SECONDS = 5;

    private final List<String> command;
    private final Path workingDirectory;
    private final RunLogPublisherPort logPublisher;

    @Override
    public ProcessResult execute(RunContext context) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workingDirectory.toFile());
        pb.redirectErrorStream(true);
        pb.environment().putAll(runEnvironment(context));
        // Resolved credentials stay out of the child; operator commands never need them.
        pb.environment().entrySet().removeIf(entry -> context.containsSecret(entry.getValue()));

        log.info("Running {} in {}", command, workingDirectory);
        Process process = pb.start();

        StringBuffer output = new StringBuffer();
        CompletableFuture<Void> reader = CompletableFuture.runAsync(() -> readOutput(process, context, output));

        try {
            int exitCode = process.waitFor();
            drain(reader);
            logPublisher.publish(context.getRunId(), "Command exited with code " + exitCode);
            return new ProcessResult(exitCode, output.toString());
        } finally {
            if (process.isAlive()) {
                log.warn("Destroying command {} of run {}", command.get(0), context.getRunId());
                process.destroyForcibly();
            }
        }
    }

    /**
     * Values the pipeline used to read from the ambient CI environment, passed explicitly.
     */
    private static Map<String, String> runEnvironment(RunContext context) {
        Map<String, String> env = new HashMap<>(context.getEnvironment());
        env.put("BUILD_NUMBER", context.getRunId());
        env.put("BRANCH_NAME", context.getBranch());
        env.put("GIT_COMMIT", context.getRevision());
        env.put("IMAGE_TAG", context.currentImage().primaryTag());
        return env;
    }

    private void readOutput(Process process, RunContext context, StringBuffer output) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String redacted = context.redact(line);
                logPublisher.publish(context.getRunId(), redacted);
                output.append(redacted).append('\n');
            }
        } catch (IOException e) {
            log.debug("Output stream of {} closed: {}", command.get(0), e.getMessage());
        }
    }

    private void drain(CompletableFuture<Void> reader) throws InterruptedException {
        try {
            reader.get(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Output of {} still open {}s after exit; a child process may hold it", command.get(0), OUTPUT_DRAIN_SECONDS);
        } catch (ExecutionException e) {
            log.warn("Reading output of {} failed", command.get(0), e.getCause());
        }
    }
}
