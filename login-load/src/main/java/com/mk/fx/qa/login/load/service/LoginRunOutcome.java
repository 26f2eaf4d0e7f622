package com.mk.fx.qa.login.load.service;

import com.mk.fx.qa.login.load.metrics.LoginStatistics;
import com.mk.fx.qa.login.load.model.LoginResult;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * What a finished run produced.
 *
 * @param runId identifier of the run
 * @param results one result per login, ordered by index
 * @param statistics aggregate statistics over {@code results}
 * @param aborted whether cancellation stopped admission early
 * @param resultsFile the persisted results file, if any
 */
public record LoginRunOutcome(
    String runId,
    List<LoginResult> results,
    LoginStatistics statistics,
    boolean aborted,
    Optional<Path> resultsFile) {}
