package com.mk.fx.qa.login.load.executors;

import com.mk.fx.qa.login.load.model.LoginTaskContext;
import com.mk.fx.qa.login.load.session.SessionTiming;

/**
 * Callback used by {@link BoundedLoginExecutor} to perform one login for a task context. Throwing
 * an exception fails only this login; the others continue.
 */
@FunctionalInterface
public interface LoginSessionRunner {
  /**
   * Performs the login described by the context.
   *
   * @param context the running task; its index and credential identify the attempt
   * @return measured timing, or {@code null} to time the call itself
   * @throws Exception to fail this login
   */
  SessionTiming run(LoginTaskContext context) throws Exception;
}
