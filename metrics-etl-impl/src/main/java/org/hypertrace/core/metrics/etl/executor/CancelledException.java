package org.hypertrace.core.metrics.etl.executor;

import lombok.Getter;
import org.hypertrace.core.metrics.etl.MetricsEtlException;

@Getter
public class CancelledException extends MetricsEtlException {
  private final int attempts;

  CancelledException(int attempts) {
    super(String.format("cancelled after %d %s", attempts, attempts == 1 ? "attempt" : "attempts"));
    this.attempts = attempts;
  }

  @Override
  public boolean isDeterministic() {
    return false;
  }
}
