package com.mk.fx.qa.login.load.session;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Timing measured by a session driver for one successful login.
 *
 * @param startTime when the login page was ready and credential entry began
 * @param finishTime when the browser landed back on the relying party
 */
public record SessionTiming(Instant startTime, Instant finishTime) {

    public SessionTiming {
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(finishTime, "finishTime");
        if (finishTime.isBefore(startTime)) {
            throw new IllegalArgumentException("finishTime must not be before startTime");
        }
    }

    public Duration duration() {
        return Duration.between(startTime, finishTime);
    }
}
