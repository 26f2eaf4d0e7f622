package com.mk.fx.qa.login.load.executors;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.login.load.cancel.CancellationToken;
import com.mk.fx.qa.login.load.credentials.CredentialSelector;
import com.mk.fx.qa.login.load.metrics.FailureClassifier;
import com.mk.fx.qa.login.load.model.LoginResult;
import com.mk.fx.qa.login.load.model.LoginTaskContext;
import com.mk.fx.qa.login.load.session.SessionTiming;
import com.mk.fx.qa.login.load.utils.LoadUtils;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

/**
 * Runs a fixed number of independent login tasks with a hard cap on how many are in flight.
 *
 * <p>Admission: a counting semaphore with {@code poolSize} permits gates a fixed worker pool of the
 * same size. Tasks are admitted strictly in index order; each finishing task returns its permit,
 * which lets the next queued task in. The cancellation token is checked at every admission
 * decision, never while a login runs.
 *
 * <p>Results: each task writes only its own {@link LoginTaskContext}. After every admitted task
 * has been joined, tasks that were never admitted are marked {@code NOT_RUN} and the contexts are
 * projected to results in index order, whatever order the logins finished in.
 */
@Slf4j
public final class BoundedLoginExecutor {

  public static final String ITERATION_MDC_KEY = "iteration";

  private static final long ADMISSION_POLL_MILLIS = 100L;
  private static final long TERMINATION_WAIT_SECONDS = 30L;

  private final Clock clock;

  public BoundedLoginExecutor(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Runs all login tasks and waits for them to drain.
   *
   * @param runId identifier used for thread names and logs
   * @param parameters task count, pool size and output root
   * @param selector source of one credential per task
   * @param cancellation checked before each admission
   * @param sessionRunner performs one login
   * @return one result per task, ordered by index
   * @throws IllegalArgumentException if the task count, pool size or credential pool is empty
   * @throws LoginExecutionException if a failure escapes a task's own error handling
   * @throws InterruptedException if the dispatching thread is interrupted
   */
  public List<LoginResult> execute(
      String runId,
      ExecutionParameters parameters,
      CredentialSelector selector,
      CancellationToken cancellation,
      LoginSessionRunner sessionRunner)
      throws InterruptedException {
    validate(runId, parameters, selector, cancellation, sessionRunner);

    var taskCount = parameters.taskCount();
    var poolSize = parameters.poolSize();
    var contexts = createContexts(parameters, selector);

    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("login-worker-" + runId + "-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };

    var permits = new Semaphore(poolSize, true);
    var executor = newFixedThreadPool(Math.min(poolSize, taskCount), threadFactory);
    List<Future<?>> futures = new ArrayList<>(taskCount);

    try {
      log.info("Run {} dispatching {} logins with concurrency {}", runId, taskCount, poolSize);
      for (LoginTaskContext context : contexts) {
        if (!awaitAdmission(permits, cancellation)) {
          log.info(
              "Run {} stopping admission at login {} due to cancellation ({}/{} admitted)",
              runId,
              context.paddedIndex(),
              futures.size(),
              taskCount);
          break;
        }
        context.markDispatched();
        try {
          futures.add(executor.submit(() -> runLogin(context, sessionRunner, permits)));
        } catch (RejectedExecutionException rejected) {
          permits.release();
          throw new LoginExecutionException(
              "Run " + runId + " could not dispatch login " + context.paddedIndex(), rejected);
        }
      }

      log.info("Run {} admission complete, awaiting {} running logins", runId, futures.size());
      awaitDrain(runId, futures);
    } finally {
      executor.shutdownNow();
      try {
        executor.awaitTermination(TERMINATION_WAIT_SECONDS, TimeUnit.SECONDS);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        throw interrupted;
      }
    }

    for (int index = futures.size(); index < taskCount; index++) {
      contexts.get(index).markNotRun();
    }
    return contexts.stream().map(LoginTaskContext::toResult).toList();
  }

  private static void validate(
      String runId,
      ExecutionParameters parameters,
      CredentialSelector selector,
      CancellationToken cancellation,
      LoginSessionRunner sessionRunner) {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(parameters, "parameters");
    Objects.requireNonNull(selector, "selector");
    Objects.requireNonNull(cancellation, "cancellation");
    Objects.requireNonNull(sessionRunner, "sessionRunner");
    if (parameters.taskCount() < 1) {
      throw new IllegalArgumentException("taskCount must be at least 1");
    }
    if (parameters.poolSize() < 1) {
      throw new IllegalArgumentException("poolSize must be at least 1");
    }
    if (selector.poolSize() < 1) {
      throw new IllegalArgumentException("Credential pool must contain at least 1 user");
    }
  }

  private static List<LoginTaskContext> createContexts(
      ExecutionParameters parameters, CredentialSelector selector) {
    List<LoginTaskContext> contexts = new ArrayList<>(parameters.taskCount());
    for (int index = 0; index < parameters.taskCount(); index++) {
      contexts.add(new LoginTaskContext(index, selector.next(), parameters.outputRoot()));
    }
    return contexts;
  }

  /**
   * Blocks until a permit is free or cancellation is requested, whichever comes first.
   *
   * @return {@code true} if a permit was taken and the task may be dispatched
   */
  private static boolean awaitAdmission(Semaphore permits, CancellationToken cancellation)
      throws InterruptedException {
    while (!cancellation.isCancellationRequested()) {
      if (permits.tryAcquire(ADMISSION_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        if (cancellation.isCancellationRequested()) {
          permits.release();
          return false;
        }
        return true;
      }
    }
    return false;
  }

  /** Executes one login inside its own error boundary and always returns the permit. */
  private void runLogin(LoginTaskContext context, LoginSessionRunner sessionRunner, Semaphore permits) {
    MDC.put(ITERATION_MDC_KEY, context.paddedIndex());
    try {
      context.markRunning(clock.instant());
      log.info("Login {} started as {}", context.paddedIndex(), context.credential().username());
      var timing = sessionRunner.run(context);
      if (timing == null) {
        timing = new SessionTiming(context.startTime().orElseThrow(), clock.instant());
      }
      context.markSucceeded(timing);
      log.info(
          "Login {} succeeded in {}s",
          context.paddedIndex(),
          LoadUtils.toSeconds(timing.duration()));
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      context.markFailed("Interrupted before completion", "INTERRUPTED");
      log.warn("Login {} interrupted", context.paddedIndex());
    } catch (Exception ex) {
      var reason = FailureClassifier.describe(ex);
      context.markFailed(reason, FailureClassifier.classify(ex));
      log.error("Login {} failed: {}", context.paddedIndex(), reason);
      log.debug("Login {} failure detail", context.paddedIndex(), ex);
    } finally {
      permits.release();
      MDC.remove(ITERATION_MDC_KEY);
    }
  }

  /** Joins every admitted login; a failure that escaped a login's boundary ends the run. */
  private static void awaitDrain(String runId, List<Future<?>> futures)
      throws InterruptedException {
    for (Future<?> future : futures) {
      try {
        future.get();
      } catch (ExecutionException failed) {
        var cause = failed.getCause() != null ? failed.getCause() : failed;
        log.error("Run {} aborted by unexpected error: {}", runId, cause.toString());
        throw new LoginExecutionException(
            "Run " + runId + " failed outside a login: " + cause, cause);
      }
    }
  }
}
