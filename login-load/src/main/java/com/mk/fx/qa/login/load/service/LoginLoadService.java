package com.mk.fx.qa.login.load.service;

import com.mk.fx.qa.login.load.artifacts.IterationArtifactSink;
import com.mk.fx.qa.login.load.cancel.CancellationController;
import com.mk.fx.qa.login.load.credentials.RandomCredentialSelector;
import com.mk.fx.qa.login.load.executors.BoundedLoginExecutor;
import com.mk.fx.qa.login.load.executors.ExecutionParameters;
import com.mk.fx.qa.login.load.metrics.LoginStatisticsCalculator;
import com.mk.fx.qa.login.load.model.LoginTaskContext;
import com.mk.fx.qa.login.load.model.RunConfiguration;
import com.mk.fx.qa.login.load.report.LoginReportPublisher;
import com.mk.fx.qa.login.load.report.RunSummary;
import com.mk.fx.qa.login.load.session.LoginSessionDriver;
import com.mk.fx.qa.login.load.session.SessionFailureException;
import com.mk.fx.qa.login.load.session.SessionTiming;
import java.time.Clock;
import java.util.Objects;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one login load test end to end: picks credentials, drives the logins through the bounded
 * executor, aggregates the results and publishes the report.
 *
 * <p>The {@link CancellationController} is told when the run starts and finishes so that an
 * interrupt arriving outside a run does not arm the watchdog. Each run gets its own driver, set up
 * with the run's navigation timeout.
 */
@Slf4j
@Service
public class LoginLoadService {

  private final LoginSessionDriverFactory driverFactory;
  private final BoundedLoginExecutor executor;
  private final LoginStatisticsCalculator calculator;
  private final LoginReportPublisher publisher;
  private final Clock clock;

  public LoginLoadService(
      LoginSessionDriverFactory driverFactory,
      BoundedLoginExecutor executor,
      LoginStatisticsCalculator calculator,
      LoginReportPublisher publisher,
      Clock clock) {
    this.driverFactory = Objects.requireNonNull(driverFactory, "driverFactory");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.calculator = Objects.requireNonNull(calculator, "calculator");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Executes the run and blocks until every admitted login has finished.
   *
   * @param configuration what to run
   * @param cancellation source of the abort signal for this run
   *
   * @throws IllegalArgumentException if the configuration cannot produce a run
   * @throws com.mk.fx.qa.login.load.executors.LoginExecutionException on an orchestration failure
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public LoginRunOutcome run(RunConfiguration configuration, CancellationController cancellation)
      throws InterruptedException {
    Objects.requireNonNull(configuration, "configuration");
    Objects.requireNonNull(cancellation, "cancellation");
    var runId = UUID.randomUUID().toString().substring(0, 8);
    var selector = RandomCredentialSelector.of(configuration.credentials(), configuration.seed());
    var parameters =
        new ExecutionParameters(
            configuration.logins(), configuration.concurrency(), configuration.outputPath());

    log.info(
        "Run {} starting {} logins against {} with concurrency {} and {} users",
        runId,
        configuration.logins(),
        configuration.startUrl(),
        configuration.concurrency(),
        selector.poolSize());

    var driver = driverFactory.create(configuration.navigationTimeout());
    var startedAt = clock.instant();
    cancellation.runStarted();
    try {
      var results =
          executor.execute(
              runId,
              parameters,
              selector,
              cancellation.token(),
              context -> drive(driver, configuration, context));
      var finishedAt = clock.instant();

      var aborted = cancellation.token().isCancellationRequested();
      var statistics = calculator.calculate(results);
      log.info(
          "Run {} {}: {} succeeded, {} failed, {} not run",
          runId,
          aborted ? "aborted" : "completed",
          statistics.successCount(),
          statistics.errorCount() - statistics.notRunCount(),
          statistics.notRunCount());

      var summary =
          RunSummary.of(runId, configuration, startedAt, finishedAt, aborted, statistics);
      var resultsFile = publisher.publish(summary, results, configuration.outputPath());
      return new LoginRunOutcome(runId, results, statistics, aborted, resultsFile);
    } finally {
      // the abort hook waits on this, so it must follow publishing
      cancellation.runFinished();
    }
  }

  private static SessionTiming drive(
      LoginSessionDriver driver, RunConfiguration configuration, LoginTaskContext context)
      throws SessionFailureException, InterruptedException {
    var artifacts = IterationArtifactSink.forContext(context, configuration.captureArtifacts());
    return driver.drive(configuration.startUrl(), context.credential(), artifacts);
  }
}
