package com.mk.fx.qa.login.load.executors;

/** Raised when a run breaks outside the per-login error boundary. */
public class LoginExecutionException extends RuntimeException {

  public LoginExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
