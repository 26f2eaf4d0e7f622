package com.mk.fx.qa.login.load.cancel;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation flag handed to the scheduler and checked at every admission decision. Once
 * set it stays set.
 */
public final class CancellationToken {

  private final AtomicBoolean requested = new AtomicBoolean();

  /**
   * Requests cancellation.
   *
   * @return {@code true} only for the call that actually set the flag
   */
  public boolean cancel() {
    return requested.compareAndSet(false, true);
  }

  public boolean isCancellationRequested() {
    return requested.get();
  }
}
