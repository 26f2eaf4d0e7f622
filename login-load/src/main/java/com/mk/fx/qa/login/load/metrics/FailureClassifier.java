package com.mk.fx.qa.login.load.metrics;

import com.mk.fx.qa.login.load.session.SessionFailureException;

/** Turns a login failure into a readable reason and a coarse category for breakdowns. */
public final class FailureClassifier {

  private FailureClassifier() {
    throw new UnsupportedOperationException("FailureClassifier cannot be instantiated");
  }

  /** Returns a one-line, human-readable description of the failure. */
  public static String describe(Throwable t) {
    if (t == null) return "Unknown failure";
    Throwable rootCause = rootCause(t);

    String msg = t.getMessage();
    if (msg == null || msg.isBlank()) {
      msg = rootCause.getMessage();
    }
    if (msg == null || msg.isBlank()) {
      return rootCause.getClass().getSimpleName() + " occurred";
    }
    if (t instanceof SessionFailureException) {
      return msg;
    }
    return t.getClass().getSimpleName() + ": " + msg;
  }

  /** Returns an upper-case category such as {@code WRONG_PAGE} or {@code NAVIGATION_TIMEOUT}. */
  public static String classify(Throwable t) {
    if (t == null) return "UNKNOWN";
    Throwable rootCause = rootCause(t);
    var clsName = rootCause.getClass().getSimpleName();
    return switch (clsName) {
      case "ConnectException" -> "CONNECTION_REFUSED";
      case "HttpTimeoutException", "HttpConnectTimeoutException", "SocketTimeoutException" ->
          "NAVIGATION_TIMEOUT";
      case "UnknownHostException" -> "UNKNOWN_HOST";
      case "SSLException", "SSLHandshakeException" -> "SSL_ERROR";
      case "SessionFailureException" -> classifySessionFailure(rootCause.getMessage());
      default -> clsName.isBlank() ? "EXCEPTION" : clsName;
    };
  }

  private static String classifySessionFailure(String message) {
    if (message == null) return "SESSION_FAILURE";
    if (message.startsWith("Ended on wrong page")) return "WRONG_PAGE";
    if (message.startsWith("Missing form")) return "MISSING_FORM_CONTROL";
    if (message.startsWith("Navigation timeout")) return "NAVIGATION_TIMEOUT";
    if (message.contains("returned HTTP")) return "HTTP_ERROR";
    return "SESSION_FAILURE";
  }

  private static Throwable rootCause(Throwable t) {
    Throwable rootCause = t;
    while (rootCause.getCause() != null && rootCause.getCause() != rootCause) {
      rootCause = rootCause.getCause();
    }
    return rootCause;
  }
}
