package org.hypertrace.core.metrics.etl;

import javax.inject.Inject;
import javax.inject.Provider;
import org.hypertrace.core.metrics.etl.config.ConfigQueryDefinitionProvider;
import org.hypertrace.core.metrics.etl.config.MetricsEtlConfig;
import org.hypertrace.core.metrics.etl.config.QueryDefinitionProvider;
import org.hypertrace.core.metrics.etl.store.JdbcConnectionProvider;
import org.hypertrace.core.metrics.etl.store.JdbcQueryDefinitionRepository;

/** Picks the config or database backed definitions per {@code etl.queryDefinitionSource}. */
final class QueryDefinitionSourceProvider implements Provider<QueryDefinitionProvider> {

  private final MetricsEtlConfig config;
  private final JdbcConnectionProvider connectionProvider;

  @Inject
  QueryDefinitionSourceProvider(
      MetricsEtlConfig config, JdbcConnectionProvider connectionProvider) {
    this.config = config;
    this.connectionProvider = connectionProvider;
  }

  @Override
  public QueryDefinitionProvider get() {
    switch (config.getEtlConfig().getQueryDefinitionSource()) {
      case DATABASE:
        return new JdbcQueryDefinitionRepository(connectionProvider);
      case CONFIG:
      default:
        return new ConfigQueryDefinitionProvider(config.getQueryDefinitions());
    }
  }
}
