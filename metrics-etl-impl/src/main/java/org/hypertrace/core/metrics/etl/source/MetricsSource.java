package org.hypertrace.core.metrics.etl.source;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Time-series backend that PromQL-style queries are evaluated against. */
public interface MetricsSource {

  QueryResult queryInstant(String query, Instant time) throws SourceException;

  QueryResult queryRange(String query, Instant start, Instant end, Duration step)
      throws SourceException;

  List<String> listMetricNames() throws SourceException;

  /** Completes normally when the source is reachable and answering queries. */
  void ping() throws SourceException;
}
