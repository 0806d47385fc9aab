package org.hypertrace.core.metrics.etl.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.NonNull;
import lombok.Value;

/**
 * One series at one instant, as returned by the metrics source. The value is still in wire form, a
 * {@code [epochSeconds, "number"]} tuple; decoding it is the normalizer's job.
 */
@Value
public class Sample {
  Map<String, String> metric;
  List<Object> value;

  public Sample(@NonNull Map<String, String> metric, @NonNull List<?> value) {
    this.metric = Collections.unmodifiableMap(new LinkedHashMap<>(metric));
    this.value = Collections.unmodifiableList(new ArrayList<>(value));
  }
}
