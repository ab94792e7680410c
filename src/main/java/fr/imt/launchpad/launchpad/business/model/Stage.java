package fr.imt.launchpad.launchpad.business.model;

import lombok.Builder;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A named unit of pipeline work. The timeout is optional; without one the stage may run indefinitely.
 */
@Builder
public record Stage(String name, StageWork work, Duration timeout, List<ResourceClaim> claims) {

    public Stage {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(work, "work");
        claims = claims == null ? List.of() : List.copyOf(claims);
    }

    public Optional<Duration> timeoutOpt() {
        return Optional.ofNullable(timeout);
    }
}
