package org.hypertrace.core.metrics.etl.executor;

import lombok.Getter;
import org.hypertrace.core.metrics.etl.MetricsEtlException;

/** Terminal failure of a query after all of its attempts; the cause is the last attempt's error. */
@Getter
public class QueryExecutionException extends MetricsEtlException {
  private final int attempts;

  QueryExecutionException(int attempts, MetricsEtlException lastError) {
    super(
        String.format(
            "query failed after %d %s: %s",
            attempts, attempts == 1 ? "attempt" : "attempts", lastError.getMessage()),
        lastError);
    this.attempts = attempts;
  }

  @Override
  public boolean isDeterministic() {
    return ((MetricsEtlException) getCause()).isDeterministic();
  }
}
