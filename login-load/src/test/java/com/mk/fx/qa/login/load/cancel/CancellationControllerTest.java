package com.mk.fx.qa.login.load.cancel;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CancellationControllerTest {

  private static final class RecordingTerminator implements ProcessTerminator {
    private final CountDownLatch called = new CountDownLatch(1);
    private final AtomicInteger status = new AtomicInteger(-1);
    private final AtomicInteger calls = new AtomicInteger();

    @Override
    public void terminate(int exitStatus) {
      status.set(exitStatus);
      calls.incrementAndGet();
      called.countDown();
    }
  }

  @Test
  void requestAbort_setsTokenOnce() {
    var controller = new CancellationController(Duration.ofSeconds(30), new RecordingTerminator());

    assertFalse(controller.token().isCancellationRequested());
    assertTrue(controller.requestAbort("test"));
    assertFalse(controller.requestAbort("test again"));
    assertTrue(controller.token().isCancellationRequested());
    assertTrue(controller.isWatchdogArmed());
  }

  @Test
  void watchdog_terminatesWithAbortStatus_afterGracePeriod() throws Exception {
    var terminator = new RecordingTerminator();
    var controller = new CancellationController(Duration.ofMillis(50), terminator);

    long start = System.nanoTime();
    controller.requestAbort("test");

    assertTrue(terminator.called.await(5, TimeUnit.SECONDS));
    assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(50));
    assertEquals(CancellationController.ABORT_EXIT_CODE, terminator.status.get());
    assertEquals(1, terminator.calls.get());
  }

  @Test
  void shutdownSignal_withoutRun_doesNothing() {
    var terminator = new RecordingTerminator();
    var controller = new CancellationController(Duration.ofMillis(10), terminator);

    controller.onShutdownSignal();

    assertFalse(controller.token().isCancellationRequested());
    assertFalse(controller.isWatchdogArmed());
  }

  @Test
  void shutdownSignal_duringRun_abortsAndWaitsForRunToFinish() throws Exception {
    var controller = new CancellationController(Duration.ofSeconds(2), new RecordingTerminator());
    controller.runStarted();

    var finisher =
        new Thread(
            () -> {
              while (!controller.token().isCancellationRequested()) {
                Thread.onSpinWait();
              }
              controller.runFinished();
            });
    finisher.start();

    long start = System.nanoTime();
    controller.onShutdownSignal();
    long waitedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertTrue(controller.token().isCancellationRequested());
    assertTrue(waitedMillis < 2000, "waited " + waitedMillis + " ms");
    finisher.join(2000);
  }

  @Test
  void runFinishedWithoutAbort_shutsWatchdogDown() {
    var terminator = new RecordingTerminator();
    var controller = new CancellationController(Duration.ofMillis(10), terminator);
    controller.runStarted();

    controller.runFinished();

    assertTrue(controller.isWatchdogShutDown());
    assertTrue(controller.requestAbort("late signal"));
    assertFalse(controller.isWatchdogArmed());
    assertEquals(0, terminator.calls.get());
  }

  @Test
  void runFinishedAfterAbort_keepsWatchdogArmed() throws Exception {
    var terminator = new RecordingTerminator();
    var controller = new CancellationController(Duration.ofMillis(50), terminator);
    controller.runStarted();
    controller.requestAbort("test");

    controller.runFinished();

    assertFalse(controller.isWatchdogShutDown());
    assertTrue(terminator.called.await(5, TimeUnit.SECONDS));
  }

  @Test
  void negativeGracePeriod_isRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new CancellationController(Duration.ofSeconds(-1), status -> {}));
  }
}
