package com.mk.fx.qa.login.load.executors;

import java.nio.file.Path;

/**
 * Parameters for a bounded login execution.
 *
 * @param taskCount total number of login tasks, at least one
 * @param poolSize maximum number of logins running at the same time, at least one
 * @param outputRoot run output directory used to derive per-iteration folders, or {@code null}
 */
public record ExecutionParameters(int taskCount, int poolSize, Path outputRoot) {}
