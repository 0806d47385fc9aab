package org.hypertrace.core.metrics.etl.time;

import java.time.Instant;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Parsed form of a relative or absolute time token. One grammar covers the offset dialect ({@code
 * now-1d/d}), the keyword dialect ({@code yesterday@08:00}) and the bare signed shorthand ({@code
 * -2h}); see {@link TimeExpressionParser}.
 */
public abstract class TimeExpression {

  private TimeExpression() {}

  public abstract <T> T accept(Visitor<T> visitor) throws TimeResolutionException;

  public interface Visitor<T> {
    T visitLiteral(Literal literal) throws TimeResolutionException;

    T visitNow(Now now) throws TimeResolutionException;

    T visitAnchored(Anchored anchored) throws TimeResolutionException;

    T visitOffset(Offset offset) throws TimeResolutionException;

    T visitTruncated(Truncated truncated) throws TimeResolutionException;
  }

  public static Literal literal(Instant instant) {
    return new Literal(instant);
  }

  public static Now now() {
    return Now.INSTANCE;
  }

  public static Anchored anchored(AnchorDay day, LocalTime timeOfDay) {
    return new Anchored(day, timeOfDay);
  }

  public static Offset offset(long amount, OffsetUnit unit) {
    return new Offset(amount, unit);
  }

  public static Truncated truncated(TimeExpression inner, ChronoUnit unit) {
    return new Truncated(inner, unit);
  }

  public enum AnchorDay {
    TODAY(0),
    YESTERDAY(-1);

    @Getter private final int dayDelta;

    AnchorDay(int dayDelta) {
      this.dayDelta = dayDelta;
    }
  }

  /** Offset units. Day and longer are calendar units, the rest fixed durations. */
  public enum OffsetUnit {
    SECOND('s', ChronoUnit.SECONDS),
    MINUTE('m', ChronoUnit.MINUTES),
    HOUR('h', ChronoUnit.HOURS),
    DAY('d', ChronoUnit.DAYS),
    WEEK('w', ChronoUnit.WEEKS),
    MONTH('M', ChronoUnit.MONTHS),
    YEAR('y', ChronoUnit.YEARS);

    @Getter private final char symbol;
    @Getter private final ChronoUnit chronoUnit;

    OffsetUnit(char symbol, ChronoUnit chronoUnit) {
      this.symbol = symbol;
      this.chronoUnit = chronoUnit;
    }

    public boolean isCalendarBased() {
      return chronoUnit.compareTo(ChronoUnit.DAYS) >= 0;
    }

    static OffsetUnit fromSymbol(char symbol) {
      for (OffsetUnit unit : values()) {
        if (unit.symbol == symbol) {
          return unit;
        }
      }
      throw new IllegalArgumentException("unknown offset unit: " + symbol);
    }
  }

  @Getter
  @ToString
  @EqualsAndHashCode(callSuper = false)
  public static final class Literal extends TimeExpression {
    @NonNull private final Instant instant;

    private Literal(@NonNull Instant instant) {
      this.instant = instant;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) throws TimeResolutionException {
      return visitor.visitLiteral(this);
    }
  }

  @ToString
  public static final class Now extends TimeExpression {
    private static final Now INSTANCE = new Now();

    private Now() {}

    @Override
    public <T> T accept(Visitor<T> visitor) throws TimeResolutionException {
      return visitor.visitNow(this);
    }
  }

  @Getter
  @ToString
  @EqualsAndHashCode(callSuper = false)
  public static final class Anchored extends TimeExpression {
    @NonNull private final AnchorDay day;
    @NonNull private final LocalTime timeOfDay;

    private Anchored(@NonNull AnchorDay day, @NonNull LocalTime timeOfDay) {
      this.day = day;
      this.timeOfDay = timeOfDay;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) throws TimeResolutionException {
      return visitor.visitAnchored(this);
    }
  }

  /** Signed offset from the reference instant; negative amounts move into the past. */
  @Getter
  @ToString
  @EqualsAndHashCode(callSuper = false)
  public static final class Offset extends TimeExpression {
    private final long amount;
    @NonNull private final OffsetUnit unit;

    private Offset(long amount, @NonNull OffsetUnit unit) {
      this.amount = amount;
      this.unit = unit;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) throws TimeResolutionException {
      return visitor.visitOffset(this);
    }
  }

  /** Truncation of the inner expression, applied after the inner expression is resolved. */
  @Getter
  @ToString
  @EqualsAndHashCode(callSuper = false)
  public static final class Truncated extends TimeExpression {
    @NonNull private final TimeExpression inner;
    @NonNull private final ChronoUnit unit;

    private Truncated(@NonNull TimeExpression inner, @NonNull ChronoUnit unit) {
      this.inner = inner;
      this.unit = unit;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) throws TimeResolutionException {
      return visitor.visitTruncated(this);
    }
  }
}
