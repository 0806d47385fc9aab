package org.hypertrace.core.metrics.etl;

import java.time.Clock;
import javax.inject.Inject;
import javax.inject.Provider;
import org.hypertrace.core.metrics.etl.config.MetricsEtlConfig;
import org.hypertrace.core.metrics.etl.normalize.SampleNormalizer;

final class SampleNormalizerProvider implements Provider<SampleNormalizer> {

  private final MetricsEtlConfig config;
  private final Clock clock;

  @Inject
  SampleNormalizerProvider(MetricsEtlConfig config, Clock clock) {
    this.config = config;
    this.clock = clock;
  }

  @Override
  public SampleNormalizer get() {
    return new SampleNormalizer(clock, config.getEtlConfig().isFailOnAllSamplesMalformed());
  }
}
