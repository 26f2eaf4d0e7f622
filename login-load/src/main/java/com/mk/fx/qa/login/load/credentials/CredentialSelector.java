package com.mk.fx.qa.login.load.credentials;

import com.mk.fx.qa.login.load.session.Credential;

/** Picks the credential used by each login task. */
public interface CredentialSelector {

  /** Returns the credential for the next task. Never {@code null}. */
  Credential next();

  /** Number of credentials available to choose from; always at least one. */
  int poolSize();
}
