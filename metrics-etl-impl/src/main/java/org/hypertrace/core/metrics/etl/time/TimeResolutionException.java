package org.hypertrace.core.metrics.etl.time;

import lombok.Getter;
import org.hypertrace.core.metrics.etl.MetricsEtlException;

@Getter
public class TimeResolutionException extends MetricsEtlException {

  public enum Reason {
    UNSUPPORTED_EXPRESSION,
    INVALID_TIME_OF_DAY
  }

  private final Reason reason;
  private final String token;

  private TimeResolutionException(Reason reason, String token, String message) {
    super(message);
    this.reason = reason;
    this.token = token;
  }

  static TimeResolutionException unsupportedExpression(String token) {
    return new TimeResolutionException(
        Reason.UNSUPPORTED_EXPRESSION, token, "unsupported time expression: " + token);
  }

  static TimeResolutionException invalidTimeOfDay(String token, String timeOfDay) {
    return new TimeResolutionException(
        Reason.INVALID_TIME_OF_DAY,
        token,
        String.format("invalid time of day '%s' in time expression: %s", timeOfDay, token));
  }

  @Override
  public boolean isDeterministic() {
    return true;
  }
}
