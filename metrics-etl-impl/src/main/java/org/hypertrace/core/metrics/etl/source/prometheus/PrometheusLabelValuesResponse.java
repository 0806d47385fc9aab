package org.hypertrace.core.metrics.etl.source.prometheus;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.io.IOException;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Response of {@code /api/v1/label/<name>/values}. */
@Value
@Jacksonized
@Builder
class PrometheusLabelValuesResponse {
  @JsonProperty("status")
  String status;

  @JsonProperty("errorType")
  String errorType;

  @JsonProperty("error")
  String error;

  @JsonProperty("data")
  List<String> data;

  static PrometheusLabelValuesResponse fromJson(String json) throws IOException {
    return PrometheusQueryResponse.OBJECT_MAPPER.readValue(
        json, PrometheusLabelValuesResponse.class);
  }
}
