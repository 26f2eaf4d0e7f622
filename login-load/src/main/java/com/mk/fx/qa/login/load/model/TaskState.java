package com.mk.fx.qa.login.load.model;

/**
 * Lifecycle of a single login task.
 *
 * <p>{@code CREATED -> DISPATCHED -> RUNNING -> SUCCEEDED | FAILED}, or {@code CREATED -> NOT_RUN}
 * when the run is aborted before the task is admitted.
 */
public enum TaskState {
  CREATED,
  DISPATCHED,
  RUNNING,
  SUCCEEDED,
  FAILED,
  NOT_RUN;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED || this == NOT_RUN;
  }
}
