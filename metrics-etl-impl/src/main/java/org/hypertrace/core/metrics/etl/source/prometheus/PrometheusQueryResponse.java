package org.hypertrace.core.metrics.etl.source.prometheus;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Envelope of the Prometheus HTTP API responses for {@code query} and {@code query_range}. */
@Value
@Jacksonized
@Builder
class PrometheusQueryResponse {
  static final String STATUS_SUCCESS = "success";

  static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  @JsonProperty("status")
  String status;

  @JsonProperty("errorType")
  String errorType;

  @JsonProperty("error")
  String error;

  @JsonProperty("data")
  PromQLData data;

  @JsonProperty("warnings")
  List<String> warnings;

  @Value
  @Jacksonized
  @Builder
  static class PromQLData {
    @JsonProperty("resultType")
    String resultType;

    // shape depends on resultType, so it is decoded after the type is known
    @JsonProperty("result")
    JsonNode result;
  }

  @Value
  @Jacksonized
  @Builder
  static class PromQLSeries {
    @JsonProperty("metric")
    Map<String, String> metric;

    @JsonProperty("value")
    List<Object> value;

    @JsonProperty("values")
    List<List<Object>> values;
  }

  static PrometheusQueryResponse fromJson(String json) throws IOException {
    return OBJECT_MAPPER.readValue(json, PrometheusQueryResponse.class);
  }
}
