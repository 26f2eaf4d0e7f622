package com.mk.fx.qa.login.load.model;

import com.mk.fx.qa.login.load.session.Credential;
import com.mk.fx.qa.login.load.session.SessionTiming;
import com.mk.fx.qa.login.load.utils.LoadUtils;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable record of one login attempt. Created by the scheduler, then owned exclusively by the
 * thread running the attempt until it reaches a terminal {@link TaskState}; after that it is only
 * read.
 *
 * <p>Hand-over between the dispatching thread and the worker happens through the executor, so no
 * locking is needed. {@link #state()} is volatile so it can be sampled from other threads.
 */
public final class LoginTaskContext {

  public static final String NOT_RUN_REASON = "Not run (aborted before dispatch)";
  public static final String NOT_RUN_TYPE = "NOT_RUN";

  private final int index;
  private final Credential credential;
  private final Path outputDir;

  private volatile TaskState state = TaskState.CREATED;
  private Instant startTime;
  private Instant finishTime;
  private String failureReason;
  private String failureType;

  /**
   * @param index zero-based iteration index, unique within a run
   * @param credential account used for this attempt
   * @param outputRoot run output directory, or {@code null} when nothing is persisted
   */
  public LoginTaskContext(int index, Credential credential, Path outputRoot) {
    if (index < 0) {
      throw new IllegalArgumentException("index must be >= 0");
    }
    this.index = index;
    this.credential = Objects.requireNonNull(credential, "credential");
    this.outputDir = outputRoot != null ? outputRoot.resolve("iteration-" + paddedIndex()) : null;
  }

  public int index() {
    return index;
  }

  public String paddedIndex() {
    return LoadUtils.padIndex(index);
  }

  public Credential credential() {
    return credential;
  }

  public Optional<Path> outputDir() {
    return Optional.ofNullable(outputDir);
  }

  public TaskState state() {
    return state;
  }

  public Optional<Instant> startTime() {
    return Optional.ofNullable(startTime);
  }

  public Optional<Instant> finishTime() {
    return Optional.ofNullable(finishTime);
  }

  public Optional<String> failureReason() {
    return Optional.ofNullable(failureReason);
  }

  public void markDispatched() {
    transition(TaskState.CREATED, TaskState.DISPATCHED);
  }

  public void markRunning(Instant invokedAt) {
    Objects.requireNonNull(invokedAt, "invokedAt");
    transition(TaskState.DISPATCHED, TaskState.RUNNING);
    this.startTime = invokedAt;
  }

  /** Records success. The driver's own measurement replaces the invocation timestamp. */
  public void markSucceeded(SessionTiming timing) {
    Objects.requireNonNull(timing, "timing");
    transition(TaskState.RUNNING, TaskState.SUCCEEDED);
    this.startTime = timing.startTime();
    this.finishTime = timing.finishTime();
  }

  public void markFailed(String reason, String type) {
    transition(TaskState.RUNNING, TaskState.FAILED);
    this.failureReason = reason == null || reason.isBlank() ? "Unknown failure" : reason;
    this.failureType = type;
  }

  public void markNotRun() {
    transition(TaskState.CREATED, TaskState.NOT_RUN);
    this.failureReason = NOT_RUN_REASON;
    this.failureType = NOT_RUN_TYPE;
  }

  /** Projects the terminal context onto a reporting {@link LoginResult}. */
  public LoginResult toResult() {
    if (!state.isTerminal()) {
      throw new IllegalStateException(
          "Login " + paddedIndex() + " has not finished (state=" + state + ")");
    }
    return new LoginResult(index, state, startTime, finishTime, failureReason, failureType);
  }

  private void transition(TaskState expected, TaskState next) {
    if (state != expected) {
      throw new IllegalStateException(
          "Login " + paddedIndex() + " cannot move from " + state + " to " + next);
    }
    state = next;
  }

  @Override
  public String toString() {
    return "LoginTaskContext[index=" + index + ", state=" + state + ", " + credential + "]";
  }
}
