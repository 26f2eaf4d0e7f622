package com.mk.fx.qa.login.load.metrics;

import com.mk.fx.qa.login.load.model.LoginResult;
import com.mk.fx.qa.login.load.model.TaskState;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Computes {@link LoginStatistics} from the index-ordered results of a drained run. Runs on a
 * single thread over immutable data.
 */
public final class LoginStatisticsCalculator {

  public LoginStatistics calculate(List<LoginResult> results) {
    Objects.requireNonNull(results, "results");

    int iterationCount = results.size();
    int successCount = 0;
    int notRunCount = 0;
    long totalMillis = 0;
    Long minMillis = null;
    Long maxMillis = null;
    Map<String, Long> breakdown = new TreeMap<>();

    for (LoginResult result : results) {
      if (result.state() == TaskState.NOT_RUN) {
        notRunCount++;
      }
      if (!result.succeeded()) {
        var type = result.failureType() == null ? "UNKNOWN" : result.failureType();
        breakdown.merge(type, 1L, Long::sum);
        continue;
      }
      successCount++;
      var millis = result.duration().map(Duration::toMillis).orElse(null);
      if (millis == null) {
        continue;
      }
      totalMillis += millis;
      minMillis = minMillis == null ? millis : Math.min(minMillis, millis);
      maxMillis = maxMillis == null ? millis : Math.max(maxMillis, millis);
    }

    int errorCount = iterationCount - successCount;
    double successRate = iterationCount == 0 ? 0.0 : (successCount * 100.0) / iterationCount;
    Double avgDuration = successCount == 0 ? null : totalMillis / 1000.0 / successCount;

    return new LoginStatistics(
        iterationCount,
        successCount,
        errorCount,
        notRunCount,
        successRate,
        minMillis == null ? null : minMillis / 1000.0,
        maxMillis == null ? null : maxMillis / 1000.0,
        avgDuration,
        Collections.unmodifiableMap(breakdown));
  }
}
