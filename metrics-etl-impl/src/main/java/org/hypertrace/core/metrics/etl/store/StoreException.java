package org.hypertrace.core.metrics.etl.store;

import lombok.Getter;
import org.hypertrace.core.metrics.etl.MetricsEtlException;

@Getter
public class StoreException extends MetricsEtlException {

  public enum Reason {
    WRITE,
    CONNECTION
  }

  private final Reason reason;

  private StoreException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public static StoreException write(String message, Throwable cause) {
    return new StoreException(Reason.WRITE, message, cause);
  }

  public static StoreException connection(String message, Throwable cause) {
    return new StoreException(Reason.CONNECTION, message, cause);
  }

  @Override
  public boolean isDeterministic() {
    return false;
  }
}
