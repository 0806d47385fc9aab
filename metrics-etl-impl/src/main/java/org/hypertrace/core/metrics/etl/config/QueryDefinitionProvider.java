package org.hypertrace.core.metrics.etl.config;

import java.util.List;
import org.hypertrace.core.metrics.etl.MetricsEtlException;

/** Source of the query definitions to run. */
public interface QueryDefinitionProvider {

  /** Enabled definitions, in the provider's stable order. */
  List<QueryDefinition> listEnabledQueryDefinitions() throws MetricsEtlException;
}
