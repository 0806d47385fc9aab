package org.hypertrace.core.metrics.etl;

/**
 * Root of the checked failures raised while resolving, planning, fetching, normalizing or
 * persisting a query. Deterministic failures reproduce on every attempt with the same input.
 */
public abstract class MetricsEtlException extends Exception {

  protected MetricsEtlException(String message) {
    super(message);
  }

  protected MetricsEtlException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract boolean isDeterministic();
}
