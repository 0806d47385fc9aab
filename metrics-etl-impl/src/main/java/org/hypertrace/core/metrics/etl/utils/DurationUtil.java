package org.hypertrace.core.metrics.etl.utils;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Parses duration strings in the {@code 1h30m}, {@code 15s}, {@code 500ms} notation used by query
 * definitions for steps, retry intervals and timeouts.
 */
public class DurationUtil {

  private static final Pattern COMPONENT_PATTERN =
      Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|µs|ms|s|m|h)");
  private static final Pattern FULL_PATTERN =
      Pattern.compile("^(?:\\d+(?:\\.\\d+)?(?:ns|us|µs|ms|s|m|h))+$");

  private static final Map<String, Long> NANOS_PER_UNIT =
      Map.of(
          "ns", 1L,
          "us", 1_000L,
          "µs", 1_000L,
          "ms", 1_000_000L,
          "s", 1_000_000_000L,
          "m", 60_000_000_000L,
          "h", 3_600_000_000_000L);

  private DurationUtil() {}

  /** Returns the parsed duration, or empty when the text is blank or malformed. */
  public static Optional<Duration> parse(String text) {
    String trimmed = StringUtils.trimToEmpty(text);
    if ("0".equals(trimmed)) {
      return Optional.of(Duration.ZERO);
    }
    if (!FULL_PATTERN.matcher(trimmed).matches()) {
      return Optional.empty();
    }
    BigDecimal nanos = BigDecimal.ZERO;
    Matcher matcher = COMPONENT_PATTERN.matcher(trimmed);
    while (matcher.find()) {
      nanos =
          nanos.add(
              new BigDecimal(matcher.group(1))
                  .multiply(BigDecimal.valueOf(NANOS_PER_UNIT.get(matcher.group(2)))));
    }
    try {
      return Optional.of(Duration.ofNanos(nanos.longValueExact()));
    } catch (ArithmeticException e) {
      return Optional.empty();
    }
  }

  public static Duration parseOrDefault(String text, Duration defaultValue) {
    return parse(text).orElse(defaultValue);
  }

  /**
   * Formats a duration the way the Prometheus HTTP API accepts it: {@code 3600s} for whole seconds,
   * fractional seconds otherwise.
   */
  public static String toPrometheusSeconds(Duration duration) {
    if (duration.getNano() == 0) {
      return duration.getSeconds() + "s";
    }
    return BigDecimal.valueOf(duration.toNanos(), 9).stripTrailingZeros().toPlainString();
  }
}
