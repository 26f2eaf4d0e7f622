package com.mk.fx.qa.login.load.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.mk.fx.qa.login.load.model.LoginResult;
import java.time.format.DateTimeFormatter;

/**
 * One line of {@code results.csv}. Absent values are {@code null} and written as empty fields.
 *
 * @param iteration zero-based iteration index
 * @param startTime formatted local start time
 * @param finishTime formatted local finish time
 * @param duration duration in seconds
 * @param failureReason failure description
 */
@JsonPropertyOrder({
  ResultRow.ITERATION,
  ResultRow.START_TIME,
  ResultRow.FINISH_TIME,
  ResultRow.DURATION,
  ResultRow.FAILURE_REASON
})
public record ResultRow(
    @JsonProperty(ITERATION) int iteration,
    @JsonProperty(START_TIME) String startTime,
    @JsonProperty(FINISH_TIME) String finishTime,
    @JsonProperty(DURATION) Double duration,
    @JsonProperty(FAILURE_REASON) String failureReason) {

  static final String ITERATION = "Iteration";
  static final String START_TIME = "Start time";
  static final String FINISH_TIME = "Finish Time";
  static final String DURATION = "Duration";
  static final String FAILURE_REASON = "Failure reason";

  static ResultRow from(LoginResult result, DateTimeFormatter timestamps) {
    return new ResultRow(
        result.index(),
        result.startTime() != null ? timestamps.format(result.startTime()) : null,
        result.finishTime() != null ? timestamps.format(result.finishTime()) : null,
        result.durationSeconds(),
        result.failureReason());
  }
}
