package org.hypertrace.core.metrics.etl.executor;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.Value;

/**
 * Audit row describing one invocation of a query: outcome, timing and number of records written.
 * End time and duration are only ever set together, by {@link #succeeded} or {@link #failed}.
 */
@Value
public class ExecutionRecord {
  String queryId;
  String queryName;
  ExecutionStatus status;
  Instant startTime;

  @Getter(AccessLevel.NONE)
  Instant endTime;

  @Getter(AccessLevel.NONE)
  Duration duration;

  int recordsCount;
  int attempts;

  @Getter(AccessLevel.NONE)
  String errorMessage;

  private ExecutionRecord(
      String queryId,
      String queryName,
      ExecutionStatus status,
      Instant startTime,
      Instant endTime,
      int recordsCount,
      int attempts,
      String errorMessage) {
    this.queryId = queryId;
    this.queryName = queryName;
    this.status = status;
    this.startTime = startTime;
    this.endTime = endTime;
    this.duration = endTime == null ? null : Duration.between(startTime, endTime);
    this.recordsCount = recordsCount;
    this.attempts = attempts;
    this.errorMessage = errorMessage;
  }

  public static ExecutionRecord started(
      @NonNull String queryId, String queryName, @NonNull Instant startTime) {
    return new ExecutionRecord(
        queryId, queryName, ExecutionStatus.RUNNING, startTime, null, 0, 0, null);
  }

  public ExecutionRecord succeeded(@NonNull Instant endTime, int recordsCount, int attempts) {
    checkRunning();
    return new ExecutionRecord(
        queryId,
        queryName,
        ExecutionStatus.SUCCESS,
        startTime,
        endTime,
        recordsCount,
        attempts,
        null);
  }

  public ExecutionRecord failed(
      @NonNull Instant endTime, int attempts, @NonNull String errorMessage) {
    checkRunning();
    return new ExecutionRecord(
        queryId, queryName, ExecutionStatus.FAILED, startTime, endTime, 0, attempts, errorMessage);
  }

  public Optional<Instant> getEndTime() {
    return Optional.ofNullable(endTime);
  }

  public Optional<Duration> getDuration() {
    return Optional.ofNullable(duration);
  }

  public Optional<String> getErrorMessage() {
    return Optional.ofNullable(errorMessage);
  }

  private void checkRunning() {
    Preconditions.checkState(
        status == ExecutionStatus.RUNNING, "execution of %s already finished", queryId);
  }
}
