package org.hypertrace.core.metrics.etl.config;

import com.google.common.base.Preconditions;
import java.util.List;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.hypertrace.core.metrics.etl.plan.TimeRangeSpec;

/** A configured query. Read-only to the executor. */
@Value
public class QueryDefinition {
  @NonNull String id;
  String name;
  String description;
  @NonNull String query;

  @Getter(AccessLevel.NONE)
  TimeRangeSpec timeRange;

  int retryCount;
  String retryInterval;
  String timeout;
  List<String> tags;
  boolean enabled;

  @Builder(toBuilder = true)
  private QueryDefinition(
      @NonNull String id,
      String name,
      String description,
      @NonNull String query,
      TimeRangeSpec timeRange,
      int retryCount,
      String retryInterval,
      String timeout,
      @Singular List<String> tags,
      boolean enabled) {
    Preconditions.checkArgument(retryCount >= 0, "retryCount must not be negative: %s", retryCount);
    this.id = id;
    this.name = name == null ? id : name;
    this.description = description;
    this.query = query;
    this.timeRange = timeRange;
    this.retryCount = retryCount;
    this.retryInterval = retryInterval;
    this.timeout = timeout;
    this.tags = tags;
    this.enabled = enabled;
  }

  public Optional<TimeRangeSpec> getTimeRange() {
    return Optional.ofNullable(timeRange);
  }
}
