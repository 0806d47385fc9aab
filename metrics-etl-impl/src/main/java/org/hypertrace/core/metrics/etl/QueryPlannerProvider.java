package org.hypertrace.core.metrics.etl;

import javax.inject.Inject;
import javax.inject.Provider;
import org.hypertrace.core.metrics.etl.config.MetricsEtlConfig;
import org.hypertrace.core.metrics.etl.plan.QueryPlanner;
import org.hypertrace.core.metrics.etl.time.TimeExpressionResolver;

final class QueryPlannerProvider implements Provider<QueryPlanner> {

  private final MetricsEtlConfig config;
  private final TimeExpressionResolver resolver;

  @Inject
  QueryPlannerProvider(MetricsEtlConfig config, TimeExpressionResolver resolver) {
    this.config = config;
    this.resolver = resolver;
  }

  @Override
  public QueryPlanner get() {
    return new QueryPlanner(resolver, config.getEtlConfig().getPlannerMode());
  }
}
