package org.hypertrace.core.metrics.etl;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import javax.inject.Inject;
import javax.inject.Provider;
import org.hypertrace.core.metrics.etl.config.MetricsEtlConfig;
import org.hypertrace.core.metrics.etl.config.MetricsEtlConfig.EtlConfig;
import org.hypertrace.core.metrics.etl.executor.RetryingExecutor;
import org.hypertrace.core.metrics.etl.normalize.SampleNormalizer;
import org.hypertrace.core.metrics.etl.plan.QueryPlanner;
import org.hypertrace.core.metrics.etl.source.MetricsSource;
import org.hypertrace.core.metrics.etl.store.RecordStore;

final class RetryingExecutorProvider implements Provider<RetryingExecutor> {

  private final MetricsEtlConfig config;
  private final QueryPlanner planner;
  private final MetricsSource source;
  private final SampleNormalizer normalizer;
  private final RecordStore store;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  @Inject
  RetryingExecutorProvider(
      MetricsEtlConfig config,
      QueryPlanner planner,
      MetricsSource source,
      SampleNormalizer normalizer,
      RecordStore store,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.config = config;
    this.planner = planner;
    this.source = source;
    this.normalizer = normalizer;
    this.store = store;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public RetryingExecutor get() {
    EtlConfig etlConfig = config.getEtlConfig();
    return new RetryingExecutor(
        planner,
        source,
        normalizer,
        store,
        clock,
        meterRegistry,
        etlConfig.getDefaultRetryInterval(),
        etlConfig.isSkipRetryOnDeterministicErrors());
  }
}
