package com.mk.fx.qa.login.load.metrics;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregate statistics of a drained run. Durations are in seconds and are computed over successful
 * logins only; they are {@code null} when no login succeeded.
 *
 * @param iterationCount number of results, one per task
 * @param successCount results without a failure reason
 * @param errorCount {@code iterationCount - successCount}, including logins that never ran
 * @param notRunCount logins never admitted because the run was aborted
 * @param successRate {@code 100 * successCount / iterationCount}, or {@code 0} for an empty run
 * @param minDuration shortest successful login
 * @param maxDuration longest successful login
 * @param avgDuration mean successful login
 * @param failureBreakdown failure category to count, sorted by category
 */
public record LoginStatistics(
    int iterationCount,
    int successCount,
    int errorCount,
    int notRunCount,
    double successRate,
    @JsonInclude(JsonInclude.Include.ALWAYS) Double minDuration,
    @JsonInclude(JsonInclude.Include.ALWAYS) Double maxDuration,
    @JsonInclude(JsonInclude.Include.ALWAYS) Double avgDuration,
    Map<String, Long> failureBreakdown) {

  public Optional<Double> minDurationSec() {
    return Optional.ofNullable(minDuration);
  }

  public Optional<Double> maxDurationSec() {
    return Optional.ofNullable(maxDuration);
  }

  public Optional<Double> avgDurationSec() {
    return Optional.ofNullable(avgDuration);
  }
}
