package com.mk.fx.qa.login.load.cancel;

/** Ends the whole process. Swapped for a recording fake in tests. */
@FunctionalInterface
public interface ProcessTerminator {

  void terminate(int status);

  /**
   * Halts the JVM without running shutdown hooks, which is the only reliable way out while the
   * hooks themselves are still waiting on the run.
   */
  static ProcessTerminator halting() {
    return status -> Runtime.getRuntime().halt(status);
  }
}
