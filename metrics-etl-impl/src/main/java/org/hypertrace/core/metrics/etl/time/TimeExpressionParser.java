package org.hypertrace.core.metrics.etl.time;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.metrics.etl.time.TimeExpression.AnchorDay;
import org.hypertrace.core.metrics.etl.time.TimeExpression.OffsetUnit;

/**
 * Parses time tokens into {@link TimeExpression}s. Accepted forms:
 *
 * <ul>
 *   <li>{@code ""}, {@code now}
 *   <li>{@code now[+-]<n><unit>} with unit in {@code s m h d w M y}, optionally suffixed with
 *       {@code /d}; {@code now/d}
 *   <li>{@code today}, {@code yesterday}, optionally suffixed with {@code @HH:MM[:SS]}
 *   <li>{@code [+-]<n><unit>} with unit in {@code d h m s}
 *   <li>ISO-8601 date-times with an offset, and epoch seconds
 * </ul>
 *
 * Keywords are case-insensitive, units are not ({@code m} is minutes, {@code M} months). Tokens
 * mixing dialects, like {@code yesterday/d} or {@code now-1d@08:00}, are rejected.
 */
public class TimeExpressionParser {

  private static final Pattern NOW_OFFSET_PATTERN =
      Pattern.compile("^(?i:now)(?:([+-])(\\d+)([smhdwMy]))?(/d)?$");
  private static final Pattern ANCHORED_PATTERN =
      Pattern.compile("^(?i:(today|yesterday))(?:@(.*))?$");
  private static final Pattern SHORTHAND_PATTERN = Pattern.compile("^([+-])(\\d+)([dhms])$");
  private static final Pattern EPOCH_SECONDS_PATTERN = Pattern.compile("^\\d+$");
  private static final Pattern TIME_OF_DAY_PATTERN =
      Pattern.compile("^(\\d{1,2}):(\\d{2})(?::(\\d{2}))?$");

  public TimeExpression parse(String token) throws TimeResolutionException {
    String expr = StringUtils.trimToEmpty(token);
    if (expr.isEmpty()) {
      return TimeExpression.now();
    }

    Matcher matcher = NOW_OFFSET_PATTERN.matcher(expr);
    if (matcher.matches()) {
      TimeExpression base =
          matcher.group(1) == null
              ? TimeExpression.now()
              : parseOffset(token, matcher.group(1), matcher.group(2), matcher.group(3));
      return matcher.group(4) == null ? base : TimeExpression.truncated(base, ChronoUnit.DAYS);
    }

    matcher = ANCHORED_PATTERN.matcher(expr);
    if (matcher.matches()) {
      AnchorDay day = AnchorDay.valueOf(matcher.group(1).toUpperCase());
      LocalTime timeOfDay =
          matcher.group(2) == null ? LocalTime.MIDNIGHT : parseTimeOfDay(token, matcher.group(2));
      return TimeExpression.anchored(day, timeOfDay);
    }

    matcher = SHORTHAND_PATTERN.matcher(expr);
    if (matcher.matches()) {
      return parseOffset(token, matcher.group(1), matcher.group(2), matcher.group(3));
    }

    if (EPOCH_SECONDS_PATTERN.matcher(expr).matches()) {
      try {
        return TimeExpression.literal(Instant.ofEpochSecond(Long.parseLong(expr)));
      } catch (NumberFormatException | DateTimeException e) {
        throw TimeResolutionException.unsupportedExpression(token);
      }
    }

    if (Character.isDigit(expr.charAt(0)) && expr.indexOf('T') > 0) {
      try {
        return TimeExpression.literal(
            OffsetDateTime.parse(expr, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant());
      } catch (DateTimeParseException e) {
        throw TimeResolutionException.unsupportedExpression(token);
      }
    }

    throw TimeResolutionException.unsupportedExpression(token);
  }

  private TimeExpression parseOffset(String token, String sign, String magnitude, String unit)
      throws TimeResolutionException {
    long amount;
    try {
      amount = Long.parseLong(magnitude);
    } catch (NumberFormatException e) {
      throw TimeResolutionException.unsupportedExpression(token);
    }
    return TimeExpression.offset(
        "-".equals(sign) ? -amount : amount, OffsetUnit.fromSymbol(unit.charAt(0)));
  }

  private LocalTime parseTimeOfDay(String token, String timeOfDay)
      throws TimeResolutionException {
    Matcher matcher = TIME_OF_DAY_PATTERN.matcher(timeOfDay);
    if (!matcher.matches()) {
      throw TimeResolutionException.invalidTimeOfDay(token, timeOfDay);
    }
    try {
      return LocalTime.of(
          Integer.parseInt(matcher.group(1)),
          Integer.parseInt(matcher.group(2)),
          matcher.group(3) == null ? 0 : Integer.parseInt(matcher.group(3)));
    } catch (DateTimeException e) {
      throw TimeResolutionException.invalidTimeOfDay(token, timeOfDay);
    }
  }
}
