package org.hypertrace.core.metrics.etl.source.prometheus;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.hypertrace.core.metrics.etl.source.MetricsSource;
import org.hypertrace.core.metrics.etl.source.QueryResult;
import org.hypertrace.core.metrics.etl.source.Sample;
import org.hypertrace.core.metrics.etl.source.SourceException;
import org.hypertrace.core.metrics.etl.source.prometheus.PrometheusQueryResponse.PromQLData;
import org.hypertrace.core.metrics.etl.source.prometheus.PrometheusQueryResponse.PromQLSeries;
import org.hypertrace.core.metrics.etl.utils.DurationUtil;

/** {@link MetricsSource} backed by the Prometheus HTTP API. Calls are synchronous. */
@Slf4j
public class PrometheusRestClient implements MetricsSource {
  private static final String INSTANT_QUERY = "api/v1/query";
  private static final String RANGE_QUERY = "api/v1/query_range";
  private static final String METRIC_NAMES = "api/v1/label/__name__/values";
  private static final String PING_QUERY = "up";

  private final HttpUrl baseUrl;
  private final String userAgent;
  private final OkHttpClient okHttpClient;
  private final Clock clock;

  public PrometheusRestClient(
      String baseUrl, String userAgent, OkHttpClient okHttpClient, Clock clock) {
    this.baseUrl = HttpUrl.get(baseUrl);
    this.userAgent = userAgent;
    this.okHttpClient = okHttpClient;
    this.clock = clock;
  }

  @Override
  public QueryResult queryInstant(String query, Instant time) throws SourceException {
    HttpUrl url =
        baseUrl
            .newBuilder()
            .addPathSegments(INSTANT_QUERY)
            .addQueryParameter("query", query)
            .addQueryParameter("time", String.valueOf(time.getEpochSecond()))
            .build();
    return toQueryResult(parseQueryResponse(execute(url)));
  }

  @Override
  public QueryResult queryRange(String query, Instant start, Instant end, Duration step)
      throws SourceException {
    HttpUrl url =
        baseUrl
            .newBuilder()
            .addPathSegments(RANGE_QUERY)
            .addQueryParameter("query", query)
            .addQueryParameter("start", String.valueOf(start.getEpochSecond()))
            .addQueryParameter("end", String.valueOf(end.getEpochSecond()))
            .addQueryParameter("step", DurationUtil.toPrometheusSeconds(step))
            .build();
    return toQueryResult(parseQueryResponse(execute(url)));
  }

  @Override
  public List<String> listMetricNames() throws SourceException {
    HttpUrl url = baseUrl.newBuilder().addPathSegments(METRIC_NAMES).build();
    String body = execute(url);
    PrometheusLabelValuesResponse response;
    try {
      response = PrometheusLabelValuesResponse.fromJson(body);
    } catch (IOException e) {
      throw SourceException.malformedResponse("unable to parse label values response", e);
    }
    if (!PrometheusQueryResponse.STATUS_SUCCESS.equals(response.getStatus())) {
      throw SourceException.nonSuccessStatus(
          response.getStatus(), response.getErrorType(), response.getError());
    }
    return response.getData() == null ? List.of() : List.copyOf(response.getData());
  }

  @Override
  public void ping() throws SourceException {
    queryInstant(PING_QUERY, clock.instant());
  }

  private String execute(HttpUrl url) throws SourceException {
    Request request =
        new Request.Builder()
            .url(url)
            .header("Accept", "application/json")
            .header("User-Agent", userAgent)
            .get()
            .build();
    log.debug("Sending request to metrics source: {}", url);
    try (Response response = okHttpClient.newCall(request).execute()) {
      ResponseBody responseBody = response.body();
      String body = responseBody == null ? "" : responseBody.string();
      if (!response.isSuccessful()) {
        throw SourceException.httpStatus(response.code(), body);
      }
      return body;
    } catch (IOException e) {
      throw SourceException.transport("request to metrics source failed: " + url.encodedPath(), e);
    }
  }

  private PrometheusQueryResponse parseQueryResponse(String body) throws SourceException {
    PrometheusQueryResponse response;
    try {
      response = PrometheusQueryResponse.fromJson(body);
    } catch (IOException e) {
      throw SourceException.malformedResponse("unable to parse query response", e);
    }
    if (response.getStatus() == null) {
      throw SourceException.malformedResponse("query response carries no status", null);
    }
    if (!PrometheusQueryResponse.STATUS_SUCCESS.equals(response.getStatus())) {
      throw SourceException.nonSuccessStatus(
          response.getStatus(), response.getErrorType(), response.getError());
    }
    if (response.getWarnings() != null && !response.getWarnings().isEmpty()) {
      log.warn("Metrics source returned warnings: {}", response.getWarnings());
    }
    return response;
  }

  private QueryResult toQueryResult(PrometheusQueryResponse response) throws SourceException {
    PromQLData data = response.getData();
    if (data == null || data.getResultType() == null) {
      throw SourceException.malformedResponse("query response carries no result type", null);
    }
    String resultType = data.getResultType();
    if (!QueryResult.RESULT_TYPE_VECTOR.equals(resultType)
        && !QueryResult.RESULT_TYPE_MATRIX.equals(resultType)) {
      throw SourceException.malformedResponse("unsupported result type: " + resultType, null);
    }

    List<Sample> samples = new ArrayList<>();
    for (PromQLSeries series : parseSeries(data.getResult())) {
      Map<String, String> metric = series.getMetric() == null ? Map.of() : series.getMetric();
      if (QueryResult.RESULT_TYPE_VECTOR.equals(resultType)) {
        samples.add(new Sample(metric, series.getValue() == null ? List.of() : series.getValue()));
      } else if (series.getValues() != null) {
        // matrix series are flattened to one sample per point
        for (List<Object> point : series.getValues()) {
          samples.add(new Sample(metric, point == null ? List.of() : point));
        }
      }
    }
    return new QueryResult(resultType, samples);
  }

  private List<PromQLSeries> parseSeries(JsonNode result) throws SourceException {
    if (result == null || result.isNull()) {
      return List.of();
    }
    if (!result.isArray()) {
      throw SourceException.malformedResponse("query result is not an array", null);
    }
    List<PromQLSeries> series = new ArrayList<>();
    for (JsonNode node : result) {
      try {
        series.add(PrometheusQueryResponse.OBJECT_MAPPER.treeToValue(node, PromQLSeries.class));
      } catch (IOException e) {
        throw SourceException.malformedResponse("unable to parse series: " + node, e);
      }
    }
    return series;
  }
}
