package com.mk.fx.qa.login.load.session;

/**
 * Performs a single login attempt against a sign-in endpoint. Callers only see two outcomes: a
 * {@link SessionTiming} on success, or a {@link SessionFailureException} describing why the attempt
 * failed. Implementations must be safe to call from many threads at once.
 */
@FunctionalInterface
public interface LoginSessionDriver {

    /**
     * Drives one login.
     *
     * @param targetUrl relying party start page; the flow must end back on this address
     * @param credential account to log in with
     * @param artifacts receives page snapshots at each step
     * @return start and finish timestamps of the login
     * @throws SessionFailureException if the flow fails at any step
     * @throws InterruptedException if the calling thread is interrupted mid-flow
     */
    SessionTiming drive(String targetUrl, Credential credential, PageArtifactSink artifacts)
            throws SessionFailureException, InterruptedException;
}
