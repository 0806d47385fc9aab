package org.hypertrace.core.metrics.etl.plan;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.metrics.etl.config.QueryDefinition;
import org.hypertrace.core.metrics.etl.plan.SourceRequest.InstantRequest;
import org.hypertrace.core.metrics.etl.plan.SourceRequest.RangeRequest;
import org.hypertrace.core.metrics.etl.plan.TimeRangeSpec.InstantSpec;
import org.hypertrace.core.metrics.etl.plan.TimeRangeSpec.RangeSpec;
import org.hypertrace.core.metrics.etl.time.ReferenceInstant;
import org.hypertrace.core.metrics.etl.time.TimeExpressionResolver;
import org.hypertrace.core.metrics.etl.time.TimeResolutionException;
import org.hypertrace.core.metrics.etl.utils.DurationUtil;

/**
 * Turns a query definition and its time range into one concrete {@link SourceRequest}. All tokens
 * of a range are resolved against the same reference instant.
 */
@Slf4j
public class QueryPlanner {

  private final TimeExpressionResolver resolver;
  private final PlannerMode mode;

  public QueryPlanner(TimeExpressionResolver resolver, PlannerMode mode) {
    this.resolver = resolver;
    this.mode = mode;
  }

  /** Plans with the definition's own time range, or an instant at the reference if it has none. */
  public SourceRequest plan(QueryDefinition query, ReferenceInstant reference)
      throws TimeResolutionException, QueryPlanException {
    Optional<TimeRangeSpec> timeRange = query.getTimeRange();
    if (timeRange.isEmpty()) {
      return new InstantRequest(query.getQuery(), reference.getInstant());
    }
    return plan(query, timeRange.get(), reference);
  }

  public SourceRequest plan(QueryDefinition query, TimeRangeSpec spec, ReferenceInstant reference)
      throws TimeResolutionException, QueryPlanException {
    if (spec instanceof InstantSpec) {
      Instant time = resolver.resolve(((InstantSpec) spec).getTime(), reference);
      return new InstantRequest(query.getQuery(), time);
    }

    if (spec instanceof RangeSpec) {
      RangeSpec range = (RangeSpec) spec;
      Instant start = resolver.resolve(range.getStart(), reference);
      Instant end = resolver.resolve(range.getEnd(), reference);
      if (start.isAfter(end)) {
        throw QueryPlanException.invalidRange(start, end);
      }
      Duration step =
          DurationUtil.parse(range.getStep())
              .filter(parsed -> !parsed.isNegative() && !parsed.isZero())
              .orElseThrow(() -> QueryPlanException.invalidStep(range.getStep()));
      return new RangeRequest(query.getQuery(), start, end, step);
    }

    if (mode == PlannerMode.STRICT) {
      throw QueryPlanException.unsupportedRangeType(spec.getType());
    }
    log.warn(
        "Query {} has unrecognized time range type '{}', evaluating at the reference instant",
        query.getId(),
        spec.getType());
    return new InstantRequest(query.getQuery(), reference.getInstant());
  }
}
