package org.hypertrace.core.metrics.etl.config;

import java.util.List;
import java.util.stream.Collectors;

/** Serves the definitions declared under {@code queries}, in declaration order. */
public class ConfigQueryDefinitionProvider implements QueryDefinitionProvider {
  private final List<QueryDefinition> queryDefinitions;

  public ConfigQueryDefinitionProvider(List<QueryDefinition> queryDefinitions) {
    this.queryDefinitions = List.copyOf(queryDefinitions);
  }

  @Override
  public List<QueryDefinition> listEnabledQueryDefinitions() {
    return queryDefinitions.stream()
        .filter(QueryDefinition::isEnabled)
        .collect(Collectors.toUnmodifiableList());
  }
}
