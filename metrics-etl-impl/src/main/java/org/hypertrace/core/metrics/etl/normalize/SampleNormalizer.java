package org.hypertrace.core.metrics.etl.normalize;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.metrics.etl.plan.SourceRequest;
import org.hypertrace.core.metrics.etl.source.Sample;

/**
 * Converts raw samples into {@link NormalizedRecord}s. The metric name comes from the {@code
 * __name__} label, falling back to the query id; the remaining labels are kept as they are.
 */
@Slf4j
public class SampleNormalizer {
  public static final String METRIC_NAME_LABEL = "__name__";

  private final Clock clock;
  private final boolean failOnAllSamplesMalformed;

  public SampleNormalizer(Clock clock, boolean failOnAllSamplesMalformed) {
    this.clock = clock;
    this.failOnAllSamplesMalformed = failOnAllSamplesMalformed;
  }

  public NormalizedRecord normalize(Sample sample, String queryId) throws NormalizationException {
    return normalize(sample, queryId, SourceRequest.RESULT_TYPE_INSTANT, clock.instant());
  }

  public NormalizedRecord normalize(
      Sample sample, String queryId, String resultType, Instant collectedAt)
      throws NormalizationException {
    List<Object> tuple = sample.getValue();
    if (tuple.size() != 2) {
      throw NormalizationException.malformedSample(
          "expected a [timestamp, value] pair but got " + tuple.size() + " elements");
    }

    NormalizedRecord.NormalizedRecordBuilder builder =
        NormalizedRecord.builder()
            .queryId(queryId)
            .metricName(extractMetricName(sample.getMetric(), queryId))
            .value(decodeValue(tuple.get(1)))
            .timestamp(decodeTimestamp(tuple.get(0)))
            .resultType(resultType)
            .collectedAt(collectedAt);
    for (Map.Entry<String, String> label : sample.getMetric().entrySet()) {
      if (!METRIC_NAME_LABEL.equals(label.getKey())) {
        builder.label(label.getKey(), label.getValue());
      }
    }
    return builder.build();
  }

  /**
   * Normalizes a batch, skipping and logging malformed samples. When every sample of a non-empty
   * batch is malformed and this normalizer is configured to treat that as failure, throws {@link
   * NormalizationException.Reason#NO_VALID_SAMPLES}.
   */
  public NormalizationResult normalizeAll(List<Sample> samples, String queryId, String resultType)
      throws NormalizationException {
    Instant collectedAt = clock.instant();
    List<NormalizedRecord> records = new ArrayList<>(samples.size());
    int skipped = 0;
    for (Sample sample : samples) {
      try {
        records.add(normalize(sample, queryId, resultType, collectedAt));
      } catch (NormalizationException e) {
        skipped++;
        log.warn("Skipping malformed sample {} of query {}: {}", sample, queryId, e.getMessage());
      }
    }
    if (records.isEmpty() && skipped > 0 && failOnAllSamplesMalformed) {
      throw NormalizationException.noValidSamples(queryId, skipped);
    }
    return new NormalizationResult(List.copyOf(records), skipped);
  }

  private String extractMetricName(Map<String, String> metric, String queryId) {
    String name = metric.get(METRIC_NAME_LABEL);
    return StringUtils.isEmpty(name) ? queryId : name;
  }

  /**
   * Decodes an epoch-seconds timestamp. Records are stored with whole-second precision, so any
   * fractional part is truncated toward zero ({@code 1435781451.781} becomes {@code 1435781451}).
   * Values outside the range {@link Instant} can represent make the sample malformed.
   */
  private Instant decodeTimestamp(Object rawTimestamp) throws NormalizationException {
    if (!(rawTimestamp instanceof Number)) {
      throw NormalizationException.malformedSample("timestamp is not a number: " + rawTimestamp);
    }
    double epochSeconds = ((Number) rawTimestamp).doubleValue();
    if (!Double.isFinite(epochSeconds)) {
      throw NormalizationException.malformedSample("timestamp is not finite: " + rawTimestamp);
    }
    if (epochSeconds < Instant.MIN.getEpochSecond()
        || epochSeconds > Instant.MAX.getEpochSecond()) {
      throw NormalizationException.malformedSample("timestamp is out of range: " + rawTimestamp);
    }
    return Instant.ofEpochSecond((long) epochSeconds);
  }

  private double decodeValue(Object rawValue) throws NormalizationException {
    if (!(rawValue instanceof String)) {
      throw NormalizationException.malformedSample("value is not a string: " + rawValue);
    }
    double value;
    try {
      value = Double.parseDouble((String) rawValue);
    } catch (NumberFormatException e) {
      throw NormalizationException.malformedSample("value is not a number: " + rawValue, e);
    }
    if (!Double.isFinite(value)) {
      throw NormalizationException.malformedSample("value is not finite: " + rawValue);
    }
    return value;
  }
}
