package fr.imt.launchpad.launchpad.business.model;

import lombok.Builder;

import java.time.Duration;
import java.time.Instant;
import java.util.function.UnaryOperator;

/**
 * Terminal result of one stage. Output is already redacted.
 */
@Builder(toBuilder = true)
public record StageOutcome(
        String stageName,
        StageStatus status,
        FailureKind failureKind,
        Integer exitCode,
        String output,
        String message,
        Instant startedAt,
        Duration duration) {

    public static StageOutcome skipped(String stageName) {
        return StageOutcome.builder()
                .stageName(stageName)
                .status(StageStatus.SKIPPED)
                .output("")
                .duration(Duration.ZERO)
                .build();
    }

    public StageOutcome redacted(UnaryOperator<String> redactor) {
        return toBuilder()
                .output(redactor.apply(output))
                .message(redactor.apply(message))
                .build();
    }

    public boolean isSucceeded() {
        return status == StageStatus.SUCCEEDED;
    }
}
