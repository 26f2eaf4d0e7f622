package com.mk.fx.qa.login.load.model;

import com.mk.fx.qa.login.load.utils.LoadUtils;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Immutable outcome of one login, decoupled from any session-driving detail. Lists of results are
 * always ordered by {@code index}.
 *
 * @param index zero-based iteration index
 * @param state terminal state of the task
 * @param startTime when the attempt started, absent when it never ran
 * @param finishTime when the attempt succeeded, absent otherwise
 * @param failureReason human-readable failure description, absent on success
 * @param failureType coarse failure category used for breakdowns, absent on success
 */
public record LoginResult(
    int index,
    TaskState state,
    Instant startTime,
    Instant finishTime,
    String failureReason,
    String failureType) {

  public boolean succeeded() {
    return failureReason == null;
  }

  /** Defined only when both timestamps are present. */
  public Optional<Duration> duration() {
    if (startTime == null || finishTime == null) {
      return Optional.empty();
    }
    return Optional.of(Duration.between(startTime, finishTime));
  }

  /** Duration in seconds at millisecond precision, or {@code null} when undefined. */
  public Double durationSeconds() {
    return duration().map(LoadUtils::toSeconds).orElse(null);
  }
}
