package com.mk.fx.qa.login.load.cancel;

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the run's {@link CancellationToken} and the shutdown watchdog.
 *
 * <p>An abort (normally triggered by Ctrl+C through the JVM shutdown hook) sets the token, which
 * stops the scheduler from admitting further logins; logins already running are left to finish.
 * At the same moment a watchdog is armed that terminates the process once the grace period has
 * elapsed, whatever state the running logins are in. Results of logins still in flight at that
 * point are lost.
 */
@Slf4j
public class CancellationController {

  public static final int ABORT_EXIT_CODE = 130;
  public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(5);

  private final CancellationToken token = new CancellationToken();
  private final Duration gracePeriod;
  private final ProcessTerminator terminator;
  private final ScheduledExecutorService watchdog;
  private final AtomicBoolean runInProgress = new AtomicBoolean();
  private final CountDownLatch runFinished = new CountDownLatch(1);
  private volatile boolean watchdogArmed;

  public CancellationController(Duration gracePeriod, ProcessTerminator terminator) {
    this.gracePeriod = Objects.requireNonNull(gracePeriod, "gracePeriod");
    this.terminator = Objects.requireNonNull(terminator, "terminator");
    if (gracePeriod.isNegative()) {
      throw new IllegalArgumentException("gracePeriod must not be negative");
    }
    this.watchdog =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r);
              t.setName("login-load-watchdog");
              t.setDaemon(true);
              return t;
            });
  }

  public CancellationToken token() {
    return token;
  }

  public Duration gracePeriod() {
    return gracePeriod;
  }

  public boolean isWatchdogArmed() {
    return watchdogArmed;
  }

  public void runStarted() {
    runInProgress.set(true);
  }

  /**
   * Marks the run as fully done, report included. Without a pending abort the watchdog is shut
   * down.
   */
  public void runFinished() {
    runInProgress.set(false);
    runFinished.countDown();
    synchronized (watchdog) {
      if (!watchdogArmed) {
        watchdog.shutdown();
      }
    }
  }

  @VisibleForTesting
  boolean isWatchdogShutDown() {
    return watchdog.isShutdown();
  }

  /**
   * Sets the abort flag and arms the watchdog. Only the first call has any effect.
   *
   * @param trigger what caused the abort, for the log
   * @return {@code true} if this call performed the abort
   */
  public boolean requestAbort(String trigger) {
    if (!token.cancel()) {
      log.debug("Abort already requested, ignoring {}", trigger);
      return false;
    }
    log.warn("Received {}. Aborting...", trigger);
    synchronized (watchdog) {
      if (watchdog.isShutdown()) {
        log.debug("Run already finished, watchdog not armed");
        return true;
      }
      watchdogArmed = true;
      watchdog.schedule(this::forceTermination, gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
    }
    return true;
  }

  /** Registers the JVM shutdown hook that turns Ctrl+C into an abort. */
  public Thread installShutdownHook() {
    var hook = new Thread(this::onShutdownSignal, "login-load-abort-hook");
    Runtime.getRuntime().addShutdownHook(hook);
    return hook;
  }

  /**
   * Invoked on JVM shutdown. Does nothing unless a run is in progress; otherwise aborts it and
   * waits for it to finish, report included, at most for the grace period.
   */
  @VisibleForTesting
  public void onShutdownSignal() {
    if (!runInProgress.get()) {
      return;
    }
    requestAbort("shutdown signal");
    try {
      if (!runFinished.await(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Run still in progress after {} ms grace period", gracePeriod.toMillis());
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private void forceTermination() {
    log.error(
        "Forcing termination {} ms after abort; results of running logins are discarded",
        gracePeriod.toMillis());
    terminator.terminate(ABORT_EXIT_CODE);
  }
}
