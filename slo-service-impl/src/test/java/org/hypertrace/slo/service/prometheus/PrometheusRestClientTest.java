package org.hypertrace.slo.service.prometheus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.reactivex.rxjava3.observers.TestObserver;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.hypertrace.slo.service.TestResources;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PrometheusRestClientTest {

  private MockWebServer mockWebServer;
  private OkHttpClient okHttpClient;
  private PrometheusRestClient prometheusRestClient;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    okHttpClient = new OkHttpClient();
    prometheusRestClient = new PrometheusRestClient(mockWebServer.url("/thanos/"), okHttpClient);
  }

  @AfterEach
  void tearDown() throws IOException {
    prometheusRestClient.close();
    mockWebServer.shutdown();
  }

  @Test
  void sendsInstantQuery() throws InterruptedException {
    mockWebServer.enqueue(getSuccessMockResponse("prometheus_vector.json"));

    QueryResult result =
        prometheusRestClient.query("sum(up)", Instant.ofEpochMilli(1435781451781L)).blockingGet();

    assertEquals(2, QueryValues.requireVector(result.getValue()).size());
    RecordedRequest request = mockWebServer.takeRequest();
    assertEquals("POST", request.getMethod());
    assertEquals("/thanos/api/v1/query", request.getPath());
    assertEquals("query=sum%28up%29&time=1435781451.781", request.getBody().readUtf8());
  }

  @Test
  void sendsRangeQuery() throws InterruptedException {
    mockWebServer.enqueue(getSuccessMockResponse("prometheus_matrix.json"));
    QueryRange range =
        QueryRange.builder()
            .start(Instant.ofEpochSecond(1435781430))
            .end(Instant.ofEpochSecond(1435781460))
            .step(Duration.ofMillis(15500))
            .build();

    QueryResult result = prometheusRestClient.queryRange("up", range).blockingGet();

    assertEquals(2, QueryValues.requireMatrix(result.getValue()).size());
    RecordedRequest request = mockWebServer.takeRequest();
    assertEquals("/thanos/api/v1/query_range", request.getPath());
    assertEquals(
        "query=up&start=1435781430&end=1435781460&step=15.5", request.getBody().readUtf8());
  }

  @Test
  void failsWithBackendError() {
    mockWebServer.enqueue(
        new MockResponse()
            .setResponseCode(400)
            .setBody(TestResources.read("prometheus_error.json")));

    TestObserver<QueryResult> observer =
        prometheusRestClient.query("sum(", Instant.EPOCH).test();

    observer.awaitDone(5, TimeUnit.SECONDS);
    observer.assertError(
        error ->
            error instanceof PrometheusQueryException
                && ((PrometheusQueryException) error)
                    .getErrorType()
                    .filter("bad_data"::equals)
                    .isPresent());
  }

  @Test
  void failsWithUnexpectedCode() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(502).setBody("bad gateway"));

    TestObserver<QueryResult> observer = prometheusRestClient.query("up", Instant.EPOCH).test();

    observer.awaitDone(5, TimeUnit.SECONDS);
    observer.assertError(
        error ->
            error instanceof PrometheusQueryException
                && error.getMessage().startsWith("Unexpected code"));
  }

  @Test
  void passesWarningsThrough() {
    mockWebServer.enqueue(getSuccessMockResponse("prometheus_warnings.json"));

    QueryResult result = prometheusRestClient.query("up", Instant.EPOCH).blockingGet();

    assertTrue(result.hasWarnings());
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\","
            + "\"result\":[{\"metric\":{}}]}}",
        "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\","
            + "\"result\":[{\"metric\":{},\"value\":[1]}]}}",
        "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\","
            + "\"result\":[{\"metric\":[],\"value\":[1,\"1\"]}]}}",
        "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\","
            + "\"result\":[{\"metric\":{\"job\":null},\"value\":[1,\"1\"]}]}}",
        "{\"status\":\"success\",\"data\":{\"resultType\":\"matrix\","
            + "\"result\":[{\"metric\":{},\"values\":[[1]]}]}}"
      })
  void failsOnMalformedSuccessResponse(String body) {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody(body));

    TestObserver<QueryResult> observer = prometheusRestClient.query("up", Instant.EPOCH).test();

    assertTrue(observer.awaitDone(5, TimeUnit.SECONDS).isTerminated());
    observer.assertError(PrometheusQueryException.class);
  }

  @Test
  void cancelsCallWhenDisposed() throws InterruptedException {
    mockWebServer.enqueue(
        getSuccessMockResponse("prometheus_vector.json").setHeadersDelay(4, TimeUnit.SECONDS));

    TestObserver<QueryResult> observer = prometheusRestClient.query("up", Instant.EPOCH).test();
    mockWebServer.takeRequest(5, TimeUnit.SECONDS);
    observer.dispose();

    awaitIdle(okHttpClient.dispatcher());
    assertEquals(0, okHttpClient.dispatcher().runningCallsCount());
    observer.assertNoValues().assertNoErrors();
  }

  @Test
  void disposedQueryLeavesCacheEmpty() throws InterruptedException {
    mockWebServer.enqueue(
        getSuccessMockResponse("prometheus_vector.json").setHeadersDelay(4, TimeUnit.SECONDS));
    QueryCache cache = new QueryCache(1000);
    CachingPrometheusClient cachingClient =
        new CachingPrometheusClient(
            prometheusRestClient, cache, Duration.ofMinutes(5), Duration.ofMinutes(10));

    TestObserver<QueryResult> observer = cachingClient.query("up", Instant.EPOCH).test();
    mockWebServer.takeRequest(5, TimeUnit.SECONDS);
    observer.dispose();

    awaitIdle(okHttpClient.dispatcher());
    assertEquals(0, cache.size());
    assertTrue(cache.get(QueryCache.key("up")).isEmpty());
  }

  @Test
  void formatsTimesAsSeconds() {
    assertEquals("0", PrometheusRestClient.formatTime(Instant.EPOCH));
    assertEquals("1.5", PrometheusRestClient.formatTime(Instant.ofEpochMilli(1500)));
    assertEquals("0.001", PrometheusRestClient.formatDuration(Duration.ofMillis(1)));
    assertEquals("3600", PrometheusRestClient.formatDuration(Duration.ofHours(1)));
  }

  private static void awaitIdle(Dispatcher dispatcher) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
    while (dispatcher.runningCallsCount() > 0 && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
  }

  private MockResponse getSuccessMockResponse(String fileName) {
    return new MockResponse()
        .setResponseCode(200)
        .addHeader("Content-Type", "application/json")
        .setBody(TestResources.read(fileName));
  }
}
