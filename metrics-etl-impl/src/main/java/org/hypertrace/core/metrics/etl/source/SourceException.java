package org.hypertrace.core.metrics.etl.source;

import java.util.Optional;
import lombok.Getter;
import org.hypertrace.core.metrics.etl.MetricsEtlException;

public class SourceException extends MetricsEtlException {

  public enum Reason {
    TRANSPORT,
    NON_SUCCESS_STATUS,
    MALFORMED_RESPONSE
  }

  @Getter private final Reason reason;
  private final Integer httpStatus;

  private SourceException(Reason reason, Integer httpStatus, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.httpStatus = httpStatus;
  }

  public static SourceException transport(String message, Throwable cause) {
    return new SourceException(Reason.TRANSPORT, null, message, cause);
  }

  public static SourceException httpStatus(int httpStatus, String body) {
    return new SourceException(
        Reason.TRANSPORT,
        httpStatus,
        String.format("metrics source returned HTTP %d: %s", httpStatus, body),
        null);
  }

  public static SourceException nonSuccessStatus(String status, String errorType, String error) {
    StringBuilder message = new StringBuilder("metrics query failed with status: ").append(status);
    if (errorType != null) {
      message.append(" (").append(errorType).append(')');
    }
    if (error != null) {
      message.append(": ").append(error);
    }
    return new SourceException(Reason.NON_SUCCESS_STATUS, null, message.toString(), null);
  }

  public static SourceException malformedResponse(String message, Throwable cause) {
    return new SourceException(Reason.MALFORMED_RESPONSE, null, message, cause);
  }

  public Optional<Integer> getHttpStatus() {
    return Optional.ofNullable(httpStatus);
  }

  @Override
  public boolean isDeterministic() {
    return false;
  }
}
