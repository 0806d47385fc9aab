package org.hypertrace.core.metrics.etl.plan;

/** How the planner treats time range types it does not recognize. */
public enum PlannerMode {
  /** Fall back to an instant request at the reference instant. */
  LENIENT,
  /** Fail with {@link QueryPlanException.Reason#UNSUPPORTED_RANGE_TYPE}. */
  STRICT
}
