package org.hypertrace.core.metrics.etl.normalize;

import com.google.common.base.Preconditions;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** A sample reshaped for storage. The value is always finite. */
@Value
public class NormalizedRecord {
  String queryId;
  String metricName;
  Map<String, String> labels;
  double value;
  Instant timestamp;
  String resultType;
  Instant collectedAt;

  @Builder
  private NormalizedRecord(
      @NonNull String queryId,
      @NonNull String metricName,
      @Singular Map<String, String> labels,
      double value,
      @NonNull Instant timestamp,
      @NonNull String resultType,
      @NonNull Instant collectedAt) {
    Preconditions.checkArgument(Double.isFinite(value), "value must be finite: %s", value);
    this.queryId = queryId;
    this.metricName = metricName;
    this.labels = labels;
    this.value = value;
    this.timestamp = timestamp;
    this.resultType = resultType;
    this.collectedAt = collectedAt;
  }
}
