package org.hypertrace.core.metrics.etl.normalize;

import lombok.Getter;
import org.hypertrace.core.metrics.etl.MetricsEtlException;

@Getter
public class NormalizationException extends MetricsEtlException {

  public enum Reason {
    MALFORMED_SAMPLE,
    NO_VALID_SAMPLES
  }

  private final Reason reason;

  private NormalizationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  static NormalizationException malformedSample(String message) {
    return new NormalizationException(Reason.MALFORMED_SAMPLE, message, null);
  }

  static NormalizationException malformedSample(String message, Throwable cause) {
    return new NormalizationException(Reason.MALFORMED_SAMPLE, message, cause);
  }

  static NormalizationException noValidSamples(String queryId, int skipped) {
    return new NormalizationException(
        Reason.NO_VALID_SAMPLES,
        String.format("all %d samples returned for query %s were malformed", skipped, queryId),
        null);
  }

  @Override
  public boolean isDeterministic() {
    return true;
  }
}
