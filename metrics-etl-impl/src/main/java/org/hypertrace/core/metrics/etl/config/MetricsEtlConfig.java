package org.hypertrace.core.metrics.etl.config;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Value;
import lombok.experimental.NonFinal;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.metrics.etl.plan.PlannerMode;

@Value
@NonFinal
public class MetricsEtlConfig {

  private static final String CONFIG_PATH_PROMETHEUS = "prometheus";
  private static final String CONFIG_PATH_DATABASE = "database";
  private static final String CONFIG_PATH_ETL = "etl";
  private static final String CONFIG_PATH_QUERIES = "queries";

  PrometheusConfig prometheusConfig;
  DatabaseConfig databaseConfig;
  EtlConfig etlConfig;
  List<QueryDefinition> queryDefinitions;

  public MetricsEtlConfig(Config config) {
    Config resolved = config.resolve();
    this.prometheusConfig = new PrometheusConfig(resolved.getConfig(CONFIG_PATH_PROMETHEUS));
    this.databaseConfig = new DatabaseConfig(resolved.getConfig(CONFIG_PATH_DATABASE));
    this.etlConfig = new EtlConfig(resolved.getConfig(CONFIG_PATH_ETL));
    this.queryDefinitions =
        resolved.hasPath(CONFIG_PATH_QUERIES)
            ? resolved.getConfigList(CONFIG_PATH_QUERIES).stream()
                .map(QueryDefinitionConfigParser::parse)
                .collect(Collectors.toUnmodifiableList())
            : List.of();
  }

  @Value
  @NonFinal
  public static class PrometheusConfig {
    private static final String CONFIG_PATH_URL = "url";
    private static final String CONFIG_PATH_TIMEOUT = "timeout";
    private static final String CONFIG_PATH_USER_AGENT = "userAgent";

    String url;
    Duration timeout;
    String userAgent;

    private PrometheusConfig(Config config) {
      this.url = config.getString(CONFIG_PATH_URL);
      Preconditions.checkArgument(StringUtils.isNotBlank(url), "prometheus.url must be set");
      this.timeout = config.getDuration(CONFIG_PATH_TIMEOUT);
      this.userAgent = config.getString(CONFIG_PATH_USER_AGENT);
    }
  }

  @Value
  @NonFinal
  public static class DatabaseConfig {
    private static final String CONFIG_PATH_URL = "url";
    private static final String CONFIG_PATH_USER = "user";
    private static final String CONFIG_PATH_PASSWORD = "password";
    private static final String CONFIG_PATH_MAX_CONNECTION_ATTEMPTS = "maxConnectionAttempts";
    private static final String CONFIG_PATH_CONNECTION_RETRY_BACKOFF = "connectionRetryBackoff";

    String url;
    String user;
    String password;
    int maxConnectionAttempts;
    Duration connectionRetryBackoff;

    private DatabaseConfig(Config config) {
      this.url = config.getString(CONFIG_PATH_URL);
      this.user = config.getString(CONFIG_PATH_USER);
      this.password = config.getString(CONFIG_PATH_PASSWORD);
      this.maxConnectionAttempts = config.getInt(CONFIG_PATH_MAX_CONNECTION_ATTEMPTS);
      Preconditions.checkArgument(
          maxConnectionAttempts > 0, "database.maxConnectionAttempts must be positive");
      this.connectionRetryBackoff = config.getDuration(CONFIG_PATH_CONNECTION_RETRY_BACKOFF);
    }
  }

  @Value
  @NonFinal
  public static class EtlConfig {
    private static final String CONFIG_PATH_TIME_ZONE = "timeZone";
    private static final String CONFIG_PATH_WORKER_POOL_SIZE = "workerPoolSize";
    private static final String CONFIG_PATH_QUERY_DEFINITION_SOURCE = "queryDefinitionSource";
    private static final String CONFIG_PATH_CHECK_CONNECTIONS = "checkConnectionsOnStartup";
    private static final String CONFIG_PATH_PLANNER_MODE = "planner.mode";
    private static final String CONFIG_PATH_DEFAULT_RETRY_INTERVAL =
        "executor.defaultRetryInterval";
    private static final String CONFIG_PATH_SKIP_RETRY_ON_DETERMINISTIC_ERRORS =
        "executor.skipRetryOnDeterministicErrors";
    private static final String CONFIG_PATH_FAIL_ON_ALL_SAMPLES_MALFORMED =
        "normalizer.failOnAllSamplesMalformed";

    ZoneId timeZone;
    int workerPoolSize;
    QueryDefinitionSource queryDefinitionSource;
    boolean checkConnectionsOnStartup;
    PlannerMode plannerMode;
    Duration defaultRetryInterval;
    boolean skipRetryOnDeterministicErrors;
    boolean failOnAllSamplesMalformed;

    private EtlConfig(Config config) {
      this.timeZone = ZoneId.of(config.getString(CONFIG_PATH_TIME_ZONE));
      this.workerPoolSize = config.getInt(CONFIG_PATH_WORKER_POOL_SIZE);
      Preconditions.checkArgument(workerPoolSize > 0, "etl.workerPoolSize must be positive");
      this.queryDefinitionSource =
          QueryDefinitionSource.fromValue(config.getString(CONFIG_PATH_QUERY_DEFINITION_SOURCE));
      this.checkConnectionsOnStartup = config.getBoolean(CONFIG_PATH_CHECK_CONNECTIONS);
      this.plannerMode = config.getEnum(PlannerMode.class, CONFIG_PATH_PLANNER_MODE);
      this.defaultRetryInterval = config.getDuration(CONFIG_PATH_DEFAULT_RETRY_INTERVAL);
      this.skipRetryOnDeterministicErrors =
          config.getBoolean(CONFIG_PATH_SKIP_RETRY_ON_DETERMINISTIC_ERRORS);
      this.failOnAllSamplesMalformed = config.getBoolean(CONFIG_PATH_FAIL_ON_ALL_SAMPLES_MALFORMED);
    }

    public enum QueryDefinitionSource {
      CONFIG,
      DATABASE;

      static QueryDefinitionSource fromValue(String value) {
        for (QueryDefinitionSource source : values()) {
          if (source.name().equalsIgnoreCase(value)) {
            return source;
          }
        }
        throw new IllegalArgumentException("Unknown query definition source: " + value);
      }
    }
  }
}
