package org.hypertrace.core.metrics.etl;

import java.time.Clock;
import javax.inject.Inject;
import javax.inject.Provider;
import okhttp3.OkHttpClient;
import org.hypertrace.core.metrics.etl.config.MetricsEtlConfig;
import org.hypertrace.core.metrics.etl.config.MetricsEtlConfig.PrometheusConfig;
import org.hypertrace.core.metrics.etl.source.MetricsSource;
import org.hypertrace.core.metrics.etl.source.prometheus.PrometheusRestClient;

final class PrometheusClientProvider implements Provider<MetricsSource> {

  private final MetricsEtlConfig config;
  private final OkHttpClient okHttpClient;
  private final Clock clock;

  @Inject
  PrometheusClientProvider(MetricsEtlConfig config, OkHttpClient okHttpClient, Clock clock) {
    this.config = config;
    this.okHttpClient = okHttpClient;
    this.clock = clock;
  }

  @Override
  public MetricsSource get() {
    PrometheusConfig prometheusConfig = config.getPrometheusConfig();
    return new PrometheusRestClient(
        prometheusConfig.getUrl(), prometheusConfig.getUserAgent(), okHttpClient, clock);
  }
}
