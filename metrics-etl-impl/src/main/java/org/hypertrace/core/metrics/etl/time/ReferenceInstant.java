package org.hypertrace.core.metrics.etl.time;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import lombok.NonNull;
import lombok.Value;

/**
 * The single wall-clock instant, together with the zone used for calendar arithmetic, that every
 * relative time expression of one invocation is resolved against. Capture it once and thread it
 * through; never read the clock again mid-chain.
 */
@Value
public class ReferenceInstant {
  @NonNull Instant instant;
  @NonNull ZoneId zone;

  public static ReferenceInstant of(Instant instant, ZoneId zone) {
    return new ReferenceInstant(instant, zone);
  }

  public static ReferenceInstant capture(Clock clock, ZoneId zone) {
    return new ReferenceInstant(clock.instant(), zone);
  }

  ZonedDateTime toZonedDateTime() {
    return instant.atZone(zone);
  }
}
