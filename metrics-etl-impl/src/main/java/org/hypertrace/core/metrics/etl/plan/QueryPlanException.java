package org.hypertrace.core.metrics.etl.plan;

import lombok.Getter;
import org.hypertrace.core.metrics.etl.MetricsEtlException;

@Getter
public class QueryPlanException extends MetricsEtlException {

  public enum Reason {
    INVALID_RANGE,
    INVALID_STEP,
    UNSUPPORTED_RANGE_TYPE
  }

  private final Reason reason;

  private QueryPlanException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  static QueryPlanException invalidRange(Object start, Object end) {
    return new QueryPlanException(
        Reason.INVALID_RANGE, String.format("range start %s is after range end %s", start, end));
  }

  static QueryPlanException invalidStep(String step) {
    return new QueryPlanException(
        Reason.INVALID_STEP, String.format("step must be a positive duration: '%s'", step));
  }

  static QueryPlanException unsupportedRangeType(String type) {
    return new QueryPlanException(
        Reason.UNSUPPORTED_RANGE_TYPE, "unsupported time range type: " + type);
  }

  @Override
  public boolean isDeterministic() {
    return true;
  }
}
