package org.hypertrace.core.metrics.etl.normalize;

import java.util.List;
import lombok.Value;

@Value
public class NormalizationResult {
  List<NormalizedRecord> records;
  int skippedCount;
}
