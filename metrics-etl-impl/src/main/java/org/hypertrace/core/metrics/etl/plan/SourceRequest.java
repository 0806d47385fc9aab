package org.hypertrace.core.metrics.etl.plan;

import java.time.Duration;
import java.time.Instant;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import org.hypertrace.core.metrics.etl.source.MetricsSource;
import org.hypertrace.core.metrics.etl.source.QueryResult;
import org.hypertrace.core.metrics.etl.source.SourceException;

/** A fully resolved request against the metrics source, produced by {@link QueryPlanner}. */
public abstract class SourceRequest {
  public static final String RESULT_TYPE_INSTANT = "instant";
  public static final String RESULT_TYPE_RANGE = "range";

  private SourceRequest() {}

  public abstract String getQuery();

  /** Result type recorded on the normalized records this request produces. */
  public abstract String getResultType();

  public abstract QueryResult execute(MetricsSource source) throws SourceException;

  @Getter
  @ToString
  @EqualsAndHashCode(callSuper = false)
  public static final class InstantRequest extends SourceRequest {
    @NonNull private final String query;
    @NonNull private final Instant time;

    InstantRequest(@NonNull String query, @NonNull Instant time) {
      this.query = query;
      this.time = time;
    }

    @Override
    public String getResultType() {
      return RESULT_TYPE_INSTANT;
    }

    @Override
    public QueryResult execute(MetricsSource source) throws SourceException {
      return source.queryInstant(query, time);
    }
  }

  @Getter
  @ToString
  @EqualsAndHashCode(callSuper = false)
  public static final class RangeRequest extends SourceRequest {
    @NonNull private final String query;
    @NonNull private final Instant start;
    @NonNull private final Instant end;
    @NonNull private final Duration step;

    RangeRequest(
        @NonNull String query,
        @NonNull Instant start,
        @NonNull Instant end,
        @NonNull Duration step) {
      this.query = query;
      this.start = start;
      this.end = end;
      this.step = step;
    }

    @Override
    public String getResultType() {
      return RESULT_TYPE_RANGE;
    }

    @Override
    public QueryResult execute(MetricsSource source) throws SourceException {
      return source.queryRange(query, start, end, step);
    }
  }
}
