package com.mk.fx.qa.login.load.service;

import com.mk.fx.qa.login.load.session.LoginSessionDriver;
import java.time.Duration;

/** Creates the session driver for a run. */
@FunctionalInterface
public interface LoginSessionDriverFactory {

  LoginSessionDriver create(Duration navigationTimeout);
}
