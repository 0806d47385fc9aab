package org.hypertrace.core.metrics.etl;

import com.google.inject.AbstractModule;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import javax.inject.Singleton;
import okhttp3.OkHttpClient;
import org.hypertrace.core.metrics.etl.config.MetricsEtlConfig;
import org.hypertrace.core.metrics.etl.config.QueryDefinitionProvider;
import org.hypertrace.core.metrics.etl.executor.RetryingExecutor;
import org.hypertrace.core.metrics.etl.normalize.SampleNormalizer;
import org.hypertrace.core.metrics.etl.plan.QueryPlanner;
import org.hypertrace.core.metrics.etl.source.MetricsSource;
import org.hypertrace.core.metrics.etl.store.JdbcConnectionProvider;
import org.hypertrace.core.metrics.etl.store.JdbcRecordStore;
import org.hypertrace.core.metrics.etl.store.RecordStore;

public class MetricsEtlModule extends AbstractModule {

  private final MetricsEtlConfig config;
  private final Clock clock;

  public MetricsEtlModule(Config config) {
    this(new MetricsEtlConfig(config), Clock.systemUTC());
  }

  MetricsEtlModule(MetricsEtlConfig config, Clock clock) {
    this.config = config;
    this.clock = clock;
  }

  @Override
  protected void configure() {
    bind(MetricsEtlConfig.class).toInstance(this.config);
    bind(Clock.class).toInstance(this.clock);
    bind(MeterRegistry.class).toInstance(new SimpleMeterRegistry());
    bind(JdbcConnectionProvider.class)
        .toInstance(new JdbcConnectionProvider(this.config.getDatabaseConfig()));
    bind(OkHttpClient.class).toProvider(OkHttpClientProvider.class).in(Singleton.class);
    bind(MetricsSource.class).toProvider(PrometheusClientProvider.class).in(Singleton.class);
    bind(RecordStore.class).to(JdbcRecordStore.class).in(Singleton.class);
    bind(QueryDefinitionProvider.class)
        .toProvider(QueryDefinitionSourceProvider.class)
        .in(Singleton.class);
    bind(QueryPlanner.class).toProvider(QueryPlannerProvider.class).in(Singleton.class);
    bind(SampleNormalizer.class).toProvider(SampleNormalizerProvider.class).in(Singleton.class);
    bind(RetryingExecutor.class).toProvider(RetryingExecutorProvider.class).in(Singleton.class);
  }
}
