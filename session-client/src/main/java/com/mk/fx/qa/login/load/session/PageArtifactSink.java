package com.mk.fx.qa.login.load.session;

import java.io.IOException;

/**
 * Receives page snapshots captured at named steps of a login flow (for example {@code
 * 001-StartPage}). Implementations decide whether and where to keep them.
 */
@FunctionalInterface
public interface PageArtifactSink {

    /** Sink that discards everything. */
    PageArtifactSink NONE = (name, page) -> {};

    /**
     * Stores the snapshot under the given step name.
     *
     * @param name step name, unique within one login flow
     * @param page the page to keep
     * @throws IOException if the snapshot cannot be stored
     */
    void capture(String name, PageSnapshot page) throws IOException;
}
