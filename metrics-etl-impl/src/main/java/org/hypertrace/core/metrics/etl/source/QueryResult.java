package org.hypertrace.core.metrics.etl.source;

import java.util.List;
import lombok.NonNull;
import lombok.Value;

@Value
public class QueryResult {
  public static final String RESULT_TYPE_VECTOR = "vector";
  public static final String RESULT_TYPE_MATRIX = "matrix";

  @NonNull String resultType;
  @NonNull List<Sample> samples;

  public QueryResult(@NonNull String resultType, @NonNull List<Sample> samples) {
    this.resultType = resultType;
    this.samples = List.copyOf(samples);
  }
}
