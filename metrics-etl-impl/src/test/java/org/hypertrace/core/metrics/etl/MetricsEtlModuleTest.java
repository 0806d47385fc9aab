package org.hypertrace.core.metrics.etl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import okhttp3.OkHttpClient;
import org.hypertrace.core.metrics.etl.config.ConfigQueryDefinitionProvider;
import org.hypertrace.core.metrics.etl.config.MetricsEtlConfig;
import org.hypertrace.core.metrics.etl.config.QueryDefinitionProvider;
import org.hypertrace.core.metrics.etl.executor.RetryingExecutor;
import org.hypertrace.core.metrics.etl.source.MetricsSource;
import org.hypertrace.core.metrics.etl.source.prometheus.PrometheusRestClient;
import org.hypertrace.core.metrics.etl.store.JdbcQueryDefinitionRepository;
import org.hypertrace.core.metrics.etl.store.JdbcRecordStore;
import org.hypertrace.core.metrics.etl.store.RecordStore;
import org.junit.jupiter.api.Test;

class MetricsEtlModuleTest {

  private static Config loadTestConfig() {
    return ConfigFactory.parseURL(
        MetricsEtlModuleTest.class.getClassLoader().getResource("application.conf"));
  }

  @Test
  void wiresTheEtlComponents() throws Exception {
    Clock clock = Clock.fixed(Instant.parse("2024-03-10T06:25:36Z"), ZoneOffset.UTC);
    Injector injector =
        Guice.createInjector(new MetricsEtlModule(new MetricsEtlConfig(loadTestConfig()), clock));

    assertSame(clock, injector.getInstance(Clock.class));
    assertTrue(injector.getInstance(MetricsSource.class) instanceof PrometheusRestClient);
    assertTrue(injector.getInstance(RecordStore.class) instanceof JdbcRecordStore);
    assertSame(injector.getInstance(RecordStore.class), injector.getInstance(RecordStore.class));
    assertEquals(10_000, injector.getInstance(OkHttpClient.class).callTimeoutMillis());
    assertNotNull(injector.getInstance(RetryingExecutor.class));

    QueryDefinitionProvider provider = injector.getInstance(QueryDefinitionProvider.class);
    assertTrue(provider instanceof ConfigQueryDefinitionProvider);
    assertEquals(2, provider.listEnabledQueryDefinitions().size());
  }

  @Test
  void databaseQueryDefinitionSource() {
    Config config =
        ConfigFactory.parseString("etl.queryDefinitionSource = database")
            .withFallback(loadTestConfig());
    Injector injector = Guice.createInjector(new MetricsEtlModule(config));

    assertTrue(
        injector.getInstance(QueryDefinitionProvider.class)
            instanceof JdbcQueryDefinitionRepository);
  }
}
