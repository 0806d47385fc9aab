package org.hypertrace.core.metrics.etl.time;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.metrics.etl.time.TimeExpression.Anchored;
import org.hypertrace.core.metrics.etl.time.TimeExpression.Literal;
import org.hypertrace.core.metrics.etl.time.TimeExpression.Now;
import org.hypertrace.core.metrics.etl.time.TimeExpression.Offset;
import org.hypertrace.core.metrics.etl.time.TimeExpression.OffsetUnit;
import org.hypertrace.core.metrics.etl.time.TimeExpression.Truncated;

/**
 * Resolves time tokens to absolute instants against a {@link ReferenceInstant}. Resolution is a
 * pure function of the token and the reference: no clock reads.
 *
 * <p>Day and longer offsets use calendar arithmetic in the reference zone. When the target month
 * is shorter than the source day-of-month the result is clamped to the last day of that month, so
 * {@code 2024-01-31 + 1M} is {@code 2024-02-29}. Second, minute and hour offsets are fixed
 * durations. Day truncation uses the wall-clock date in the reference zone.
 */
@Singleton
public class TimeExpressionResolver {

  private static final TimeExpression START_OF_TODAY =
      TimeExpression.truncated(TimeExpression.now(), ChronoUnit.DAYS);
  private static final TimeExpression START_OF_YESTERDAY =
      TimeExpression.truncated(
          TimeExpression.offset(-1, OffsetUnit.DAY), ChronoUnit.DAYS);
  private static final TimeExpression START_OF_TOMORROW =
      TimeExpression.truncated(TimeExpression.offset(1, OffsetUnit.DAY), ChronoUnit.DAYS);

  private final TimeExpressionParser parser;

  @Inject
  public TimeExpressionResolver(TimeExpressionParser parser) {
    this.parser = parser;
  }

  public TimeExpressionResolver() {
    this(new TimeExpressionParser());
  }

  public Instant resolve(String token, ReferenceInstant reference)
      throws TimeResolutionException {
    TimeExpression expression = parser.parse(token);
    try {
      return resolve(expression, reference);
    } catch (DateTimeException | ArithmeticException e) {
      // magnitude pushed the result outside the supported date range
      throw TimeResolutionException.unsupportedExpression(token);
    }
  }

  public Instant resolve(TimeExpression expression, ReferenceInstant reference)
      throws TimeResolutionException {
    return expression.accept(new Evaluator(reference)).toInstant();
  }

  /** Yesterday 00:00:00 (inclusive) to today 00:00:00 (exclusive) in the reference zone. */
  public TimeWindow yesterdayWindow(ReferenceInstant reference) throws TimeResolutionException {
    return new TimeWindow(
        resolve(START_OF_YESTERDAY, reference), resolve(START_OF_TODAY, reference));
  }

  /** Today 00:00:00 (inclusive) to tomorrow 00:00:00 (exclusive) in the reference zone. */
  public TimeWindow todayWindow(ReferenceInstant reference) throws TimeResolutionException {
    return new TimeWindow(
        resolve(START_OF_TODAY, reference), resolve(START_OF_TOMORROW, reference));
  }

  private static class Evaluator implements TimeExpression.Visitor<ZonedDateTime> {
    private final ReferenceInstant reference;

    private Evaluator(ReferenceInstant reference) {
      this.reference = reference;
    }

    @Override
    public ZonedDateTime visitLiteral(Literal literal) {
      return literal.getInstant().atZone(reference.getZone());
    }

    @Override
    public ZonedDateTime visitNow(Now now) {
      return reference.toZonedDateTime();
    }

    @Override
    public ZonedDateTime visitAnchored(Anchored anchored) {
      return reference
          .toZonedDateTime()
          .toLocalDate()
          .plusDays(anchored.getDay().getDayDelta())
          .atTime(anchored.getTimeOfDay())
          .atZone(reference.getZone());
    }

    @Override
    public ZonedDateTime visitOffset(Offset offset) {
      ZonedDateTime base = reference.toZonedDateTime();
      OffsetUnit unit = offset.getUnit();
      if (unit.isCalendarBased()) {
        return base.plus(offset.getAmount(), unit.getChronoUnit());
      }
      return base.plus(unit.getChronoUnit().getDuration().multipliedBy(offset.getAmount()));
    }

    @Override
    public ZonedDateTime visitTruncated(Truncated truncated) throws TimeResolutionException {
      ZonedDateTime inner = truncated.getInner().accept(this);
      if (truncated.getUnit() != ChronoUnit.DAYS) {
        throw new IllegalStateException("unsupported truncation unit: " + truncated.getUnit());
      }
      return inner.toLocalDate().atStartOfDay(reference.getZone());
    }
  }
}
