package com.mk.fx.qa.login.load.session;

/** Raised by a {@link LoginSessionDriver} when a login attempt does not complete. */
public class SessionFailureException extends Exception {

    public SessionFailureException(String message) {
        super(message);
    }

    public SessionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
