package org.hypertrace.core.metrics.etl;

import javax.inject.Inject;
import javax.inject.Provider;
import okhttp3.OkHttpClient;
import org.hypertrace.core.metrics.etl.config.MetricsEtlConfig;

final class OkHttpClientProvider implements Provider<OkHttpClient> {

  private final MetricsEtlConfig config;

  @Inject
  OkHttpClientProvider(MetricsEtlConfig config) {
    this.config = config;
  }

  @Override
  public OkHttpClient get() {
    return new OkHttpClient.Builder()
        .callTimeout(config.getPrometheusConfig().getTimeout())
        .build();
  }
}
