package org.hypertrace.core.metrics.etl.source.prometheus;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.hypertrace.core.metrics.etl.source.QueryResult;
import org.hypertrace.core.metrics.etl.source.Sample;
import org.hypertrace.core.metrics.etl.source.SourceException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class PrometheusRestClientTest {

  private static final Instant NOW = Instant.parse("2024-03-10T06:25:36Z");

  private MockWebServer mockWebServer;
  private PrometheusRestClient prometheusRestClient;

  @BeforeEach
  public void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    OkHttpClient okHttpClient =
        new OkHttpClient.Builder().callTimeout(Duration.ofSeconds(2)).build();
    prometheusRestClient =
        new PrometheusRestClient(
            mockWebServer.url("/").toString(),
            "metrics-etl-test",
            okHttpClient,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @AfterEach
  public void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  public void testInstantQuery() throws Exception {
    mockWebServer.enqueue(getSuccessMockResponse("promql_vector_result.json"));

    QueryResult result =
        prometheusRestClient.queryInstant("up", Instant.ofEpochSecond(1435781451L));

    Assertions.assertEquals(QueryResult.RESULT_TYPE_VECTOR, result.getResultType());
    Assertions.assertEquals(2, result.getSamples().size());
    Sample first = result.getSamples().get(0);
    Assertions.assertEquals(
        Map.of("__name__", "up", "job", "prometheus", "instance", "localhost:9090"),
        first.getMetric());
    Assertions.assertEquals(List.of(1435781451.781, "1"), first.getValue());

    RecordedRequest request = mockWebServer.takeRequest();
    HttpUrl url = request.getRequestUrl();
    Assertions.assertEquals("GET", request.getMethod());
    Assertions.assertEquals("/api/v1/query", url.encodedPath());
    Assertions.assertEquals("up", url.queryParameter("query"));
    Assertions.assertEquals("1435781451", url.queryParameter("time"));
    Assertions.assertEquals("application/json", request.getHeader("Accept"));
    Assertions.assertEquals("metrics-etl-test", request.getHeader("User-Agent"));
  }

  @Test
  public void testRangeQueryFlattensSeries() throws Exception {
    mockWebServer.enqueue(getSuccessMockResponse("promql_matrix_result.json"));

    QueryResult result =
        prometheusRestClient.queryRange(
            "rate(http_requests_total[5m])",
            Instant.ofEpochSecond(1435781430L),
            Instant.ofEpochSecond(1435781460L),
            Duration.ofSeconds(15));

    Assertions.assertEquals(QueryResult.RESULT_TYPE_MATRIX, result.getResultType());
    Assertions.assertEquals(5, result.getSamples().size());
    Assertions.assertEquals(List.of(1435781445.781, "1"), result.getSamples().get(1).getValue());
    Assertions.assertEquals(
        "localhost:9091", result.getSamples().get(4).getMetric().get("instance"));

    HttpUrl url = mockWebServer.takeRequest().getRequestUrl();
    Assertions.assertEquals("/api/v1/query_range", url.encodedPath());
    Assertions.assertEquals("rate(http_requests_total[5m])", url.queryParameter("query"));
    Assertions.assertEquals("1435781430", url.queryParameter("start"));
    Assertions.assertEquals("1435781460", url.queryParameter("end"));
    Assertions.assertEquals("15s", url.queryParameter("step"));
  }

  @Test
  public void testErrorStatus() {
    mockWebServer.enqueue(getSuccessMockResponse("promql_error_result.json"));

    SourceException exception =
        Assertions.assertThrows(
            SourceException.class, () -> prometheusRestClient.queryInstant("up{", NOW));

    Assertions.assertEquals(SourceException.Reason.NON_SUCCESS_STATUS, exception.getReason());
    Assertions.assertTrue(exception.getMessage().contains("bad_data"));
    Assertions.assertFalse(exception.isDeterministic());
  }

  @Test
  public void testNonSuccessHttpStatusIsATransportFailure() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));

    SourceException exception =
        Assertions.assertThrows(
            SourceException.class, () -> prometheusRestClient.queryInstant("up", NOW));

    Assertions.assertEquals(SourceException.Reason.TRANSPORT, exception.getReason());
    Assertions.assertEquals(503, exception.getHttpStatus().orElseThrow());
    Assertions.assertTrue(exception.getMessage().contains("unavailable"));
  }

  @Test
  public void testConnectionFailureIsATransportFailure() {
    mockWebServer.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));

    SourceException exception =
        Assertions.assertThrows(
            SourceException.class, () -> prometheusRestClient.queryInstant("up", NOW));

    Assertions.assertEquals(SourceException.Reason.TRANSPORT, exception.getReason());
    Assertions.assertTrue(exception.getHttpStatus().isEmpty());
  }

  @Test
  public void testMalformedResponses() {
    mockWebServer.enqueue(jsonResponse("not json"));
    mockWebServer.enqueue(getSuccessMockResponse("promql_scalar_result.json"));
    mockWebServer.enqueue(
        jsonResponse(
            "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":{}}}"));

    for (int i = 0; i < 3; i++) {
      SourceException exception =
          Assertions.assertThrows(
              SourceException.class, () -> prometheusRestClient.queryInstant("up", NOW));
      Assertions.assertEquals(SourceException.Reason.MALFORMED_RESPONSE, exception.getReason());
    }
  }

  @Test
  public void testWarningsDoNotFailTheQuery() throws Exception {
    mockWebServer.enqueue(getSuccessMockResponse("promql_warning_result.json"));

    QueryResult result = prometheusRestClient.queryInstant("up", NOW);

    Assertions.assertTrue(result.getSamples().isEmpty());
  }

  @Test
  public void testListMetricNames() throws Exception {
    mockWebServer.enqueue(getSuccessMockResponse("label_values_result.json"));

    Assertions.assertEquals(
        List.of("go_goroutines", "node_cpu_seconds_total", "up"),
        prometheusRestClient.listMetricNames());
    Assertions.assertEquals(
        "/api/v1/label/__name__/values", mockWebServer.takeRequest().getRequestUrl().encodedPath());
  }

  @Test
  public void testPingQueriesUpAtTheCurrentInstant() throws Exception {
    mockWebServer.enqueue(getSuccessMockResponse("promql_vector_result.json"));

    prometheusRestClient.ping();

    HttpUrl url = mockWebServer.takeRequest().getRequestUrl();
    Assertions.assertEquals("up", url.queryParameter("query"));
    Assertions.assertEquals(String.valueOf(NOW.getEpochSecond()), url.queryParameter("time"));
  }

  @Test
  public void testPingFailure() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(500));

    Assertions.assertThrows(SourceException.class, () -> prometheusRestClient.ping());
  }

  private MockResponse getSuccessMockResponse(String fileName) {
    URL fileUrl = PrometheusRestClientTest.class.getClassLoader().getResource(fileName);
    String content;
    try {
      content =
          new String(Files.readAllBytes(Paths.get(fileUrl.getFile())), StandardCharsets.UTF_8);
    } catch (IOException ioException) {
      throw new RuntimeException(ioException);
    }
    return jsonResponse(content);
  }

  private MockResponse jsonResponse(String body) {
    return new MockResponse()
        .setResponseCode(200)
        .addHeader("Content-Type", "application/json")
        .setBody(body);
  }
}
