package com.mk.fx.qa.login.load.report;

import com.mk.fx.qa.login.load.metrics.LoginStatistics;
import com.mk.fx.qa.login.load.model.RunConfiguration;
import java.time.Instant;

/**
 * Contents of {@code summary.json}: what was run and how it went.
 *
 * @param runId identifier of the run
 * @param startUrl relying party start page
 * @param logins requested number of logins
 * @param concurrency maximum logins in flight
 * @param users size of the credential pool
 * @param startedAt when dispatch began
 * @param finishedAt when the run drained
 * @param aborted whether the run was cancelled before every login was admitted
 * @param statistics aggregate statistics
 */
public record RunSummary(
    String runId,
    String startUrl,
    int logins,
    int concurrency,
    int users,
    Instant startedAt,
    Instant finishedAt,
    boolean aborted,
    LoginStatistics statistics) {

  public static RunSummary of(
      String runId,
      RunConfiguration configuration,
      Instant startedAt,
      Instant finishedAt,
      boolean aborted,
      LoginStatistics statistics) {
    return new RunSummary(
        runId,
        configuration.startUrl(),
        configuration.logins(),
        configuration.concurrency(),
        configuration.credentials().size(),
        startedAt,
        finishedAt,
        aborted,
        statistics);
  }
}
