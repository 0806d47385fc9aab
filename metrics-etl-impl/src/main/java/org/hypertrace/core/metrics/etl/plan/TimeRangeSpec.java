package org.hypertrace.core.metrics.etl.plan;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * How a query's evaluation time is chosen: a single instant, or a range with a step. Time fields
 * hold unresolved tokens, see {@link org.hypertrace.core.metrics.etl.time.TimeExpressionParser}.
 */
public abstract class TimeRangeSpec {
  public static final String TYPE_INSTANT = "instant";
  public static final String TYPE_RANGE = "range";

  private TimeRangeSpec() {}

  public abstract String getType();

  public static InstantSpec instant(String time) {
    return new InstantSpec(time == null ? "" : time);
  }

  public static RangeSpec range(String start, String end, String step) {
    return new RangeSpec(
        start == null ? "" : start, end == null ? "" : end, step == null ? "" : step);
  }

  /**
   * Builds a spec from its configured form. Types other than {@code instant} and {@code range}
   * are kept as {@link UnrecognizedSpec} for the planner to accept or reject.
   */
  public static TimeRangeSpec of(String type, String time, String start, String end, String step) {
    if (type == null || TYPE_INSTANT.equalsIgnoreCase(type)) {
      return instant(time);
    }
    if (TYPE_RANGE.equalsIgnoreCase(type)) {
      return range(start, end, step);
    }
    return new UnrecognizedSpec(type);
  }

  @Getter
  @ToString
  @EqualsAndHashCode(callSuper = false)
  public static final class InstantSpec extends TimeRangeSpec {
    private final String time;

    private InstantSpec(String time) {
      this.time = time;
    }

    @Override
    public String getType() {
      return TYPE_INSTANT;
    }
  }

  @Getter
  @ToString
  @EqualsAndHashCode(callSuper = false)
  public static final class RangeSpec extends TimeRangeSpec {
    private final String start;
    private final String end;
    private final String step;

    private RangeSpec(String start, String end, String step) {
      this.start = start;
      this.end = end;
      this.step = step;
    }

    @Override
    public String getType() {
      return TYPE_RANGE;
    }
  }

  @ToString
  @EqualsAndHashCode(callSuper = false)
  public static final class UnrecognizedSpec extends TimeRangeSpec {
    private final String type;

    private UnrecognizedSpec(String type) {
      this.type = type;
    }

    @Override
    public String getType() {
      return type;
    }
  }
}
