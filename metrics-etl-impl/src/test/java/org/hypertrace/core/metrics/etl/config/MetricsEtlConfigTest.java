package org.hypertrace.core.metrics.etl.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import org.hypertrace.core.metrics.etl.config.MetricsEtlConfig.EtlConfig;
import org.hypertrace.core.metrics.etl.config.MetricsEtlConfig.EtlConfig.QueryDefinitionSource;
import org.hypertrace.core.metrics.etl.plan.PlannerMode;
import org.hypertrace.core.metrics.etl.plan.TimeRangeSpec;
import org.junit.jupiter.api.Test;

class MetricsEtlConfigTest {

  private static Config loadTestConfig() {
    return ConfigFactory.parseURL(
        MetricsEtlConfigTest.class.getClassLoader().getResource("application.conf"));
  }

  @Test
  void parsesAllSections() {
    MetricsEtlConfig config = new MetricsEtlConfig(loadTestConfig());

    assertEquals("http://prometheus.monitoring:9090", config.getPrometheusConfig().getUrl());
    assertEquals(Duration.ofSeconds(10), config.getPrometheusConfig().getTimeout());
    assertEquals("metrics-etl-test", config.getPrometheusConfig().getUserAgent());

    assertEquals("jdbc:postgresql://db:5432/metrics", config.getDatabaseConfig().getUrl());
    assertEquals("etl", config.getDatabaseConfig().getUser());
    assertEquals(2, config.getDatabaseConfig().getMaxConnectionAttempts());
    assertEquals(Duration.ofMillis(100), config.getDatabaseConfig().getConnectionRetryBackoff());

    EtlConfig etlConfig = config.getEtlConfig();
    assertEquals(ZoneId.of("Asia/Shanghai"), etlConfig.getTimeZone());
    assertEquals(2, etlConfig.getWorkerPoolSize());
    assertEquals(QueryDefinitionSource.CONFIG, etlConfig.getQueryDefinitionSource());
    assertFalse(etlConfig.isCheckConnectionsOnStartup());
    assertEquals(PlannerMode.STRICT, etlConfig.getPlannerMode());
    assertEquals(Duration.ofSeconds(2), etlConfig.getDefaultRetryInterval());
    assertTrue(etlConfig.isSkipRetryOnDeterministicErrors());
    assertFalse(etlConfig.isFailOnAllSamplesMalformed());
  }

  @Test
  void parsesQueryDefinitionsInDeclarationOrder() {
    List<QueryDefinition> definitions =
        new MetricsEtlConfig(loadTestConfig()).getQueryDefinitions();

    assertEquals(3, definitions.size());
    QueryDefinition cpu = definitions.get(0);
    assertEquals("cpu_usage", cpu.getId());
    assertEquals("CPU usage", cpu.getName());
    assertEquals("CPU utilisation per instance", cpu.getDescription());
    assertEquals(3, cpu.getRetryCount());
    assertEquals("5s", cpu.getRetryInterval());
    assertEquals("30s", cpu.getTimeout());
    assertEquals(List.of("system", "cpu"), cpu.getTags());
    assertTrue(cpu.isEnabled());
    assertTrue(cpu.getTimeRange().isEmpty());

    QueryDefinition memory = definitions.get(1);
    assertEquals("memory_yesterday", memory.getName());
    assertFalse(memory.isEnabled());
    assertEquals(0, memory.getRetryCount());
    assertEquals(
        TimeRangeSpec.range("yesterday@00:00", "today@00:00", "1h"),
        memory.getTimeRange().orElseThrow());

    assertEquals(
        TimeRangeSpec.instant("now/d"), definitions.get(2).getTimeRange().orElseThrow());
  }

  @Test
  void referenceDefaultsApply() {
    Config config =
        ConfigFactory.parseString("queries = []")
            .withFallback(ConfigFactory.parseResources("reference.conf"));

    MetricsEtlConfig etlConfig = new MetricsEtlConfig(config);

    assertEquals(ZoneOffset.ofHours(8), etlConfig.getEtlConfig().getTimeZone());
    assertEquals(PlannerMode.LENIENT, etlConfig.getEtlConfig().getPlannerMode());
    assertEquals(Duration.ofSeconds(5), etlConfig.getEtlConfig().getDefaultRetryInterval());
    assertFalse(etlConfig.getEtlConfig().isSkipRetryOnDeterministicErrors());
    assertTrue(etlConfig.getEtlConfig().isFailOnAllSamplesMalformed());
    assertTrue(etlConfig.getQueryDefinitions().isEmpty());
  }

  @Test
  void blankPrometheusUrlIsRejected() {
    Config config =
        ConfigFactory.parseString("prometheus.url = \"  \"")
            .withFallback(loadTestConfig());

    assertThrows(IllegalArgumentException.class, () -> new MetricsEtlConfig(config));
  }

  @Test
  void queryWithoutTextIsRejected() {
    Config config =
        ConfigFactory.parseString("queries = [{ id = broken }]").withFallback(loadTestConfig());

    assertThrows(IllegalArgumentException.class, () -> new MetricsEtlConfig(config));
  }

  @Test
  void unknownQueryDefinitionSourceIsRejected() {
    Config config =
        ConfigFactory.parseString("etl.queryDefinitionSource = s3").withFallback(loadTestConfig());

    assertThrows(IllegalArgumentException.class, () -> new MetricsEtlConfig(config));
  }
}
