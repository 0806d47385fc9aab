package org.hypertrace.core.metrics.etl.time;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.time.Instant;
import lombok.Value;

/** Half-open interval {@code [start, end)}. */
@Value
public class TimeWindow {
  Instant start;
  Instant end;

  public TimeWindow(Instant start, Instant end) {
    Preconditions.checkArgument(
        !start.isAfter(end), "window start %s is after window end %s", start, end);
    this.start = start;
    this.end = end;
  }

  public Duration getLength() {
    return Duration.between(start, end);
  }
}
