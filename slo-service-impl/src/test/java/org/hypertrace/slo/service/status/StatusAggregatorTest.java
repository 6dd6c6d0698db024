package org.hypertrace.slo.service.status;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.reactivex.rxjava3.core.Single;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.hypertrace.slo.service.api.Indicator;
import org.hypertrace.slo.service.api.Metric;
import org.hypertrace.slo.service.api.Objective;
import org.hypertrace.slo.service.api.ObjectiveStatus;
import org.hypertrace.slo.service.api.RatioIndicator;
import org.hypertrace.slo.service.prometheus.Labels;
import org.hypertrace.slo.service.prometheus.MatrixValue;
import org.hypertrace.slo.service.prometheus.PrometheusClient;
import org.hypertrace.slo.service.prometheus.QueryResult;
import org.hypertrace.slo.service.prometheus.Sample;
import org.hypertrace.slo.service.prometheus.UnexpectedResultTypeException;
import org.hypertrace.slo.service.prometheus.VectorValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StatusAggregatorTest {
  private static final Instant NOW = Instant.parse("2023-05-01T10:01:30Z");
  private static final Instant ROUNDED = Instant.parse("2023-05-01T10:05:00Z");
  private static final Labels API = Labels.of(Map.of("handler", "/api"));
  private static final Labels HEALTH = Labels.of(Map.of("handler", "/health"));
  private static final Labels ADMIN = Labels.of(Map.of("handler", "/admin"));

  private static final Objective OBJECTIVE =
      Objective.builder()
          .labels(Map.of("__name__", "api"))
          .target(0.99)
          .window(Duration.ofDays(30))
          .indicator(
              Indicator.builder()
                  .ratio(
                      RatioIndicator.builder()
                          .errors(Metric.parse("http_requests_total{code=~\"5..\"}"))
                          .total(Metric.parse("http_requests_total"))
                          .grouping(List.of("handler"))
                          .build())
                  .build())
          .build();

  @Mock private PrometheusClient prometheusClient;
  private StatusAggregator aggregator;

  @BeforeEach
  void setUp() {
    aggregator = new StatusAggregator(prometheusClient, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void computesAvailabilityAndBudget() {
    stubQueries(vector(sample(API, 10000)), vector(sample(API, 50)));

    List<ObjectiveStatus> statuses = aggregator.status(OBJECTIVE).blockingGet();

    assertEquals(1, statuses.size());
    ObjectiveStatus status = statuses.get(0);
    assertEquals(Map.of("handler", "/api"), status.getLabels());
    assertEquals(0.995, status.getAvailability().getPercentage(), 1e-9);
    assertEquals(10000, status.getAvailability().getTotal());
    assertEquals(50, status.getAvailability().getErrors());
    assertEquals(0.01, status.getBudget().getTotal(), 1e-9);
    assertEquals(0.5, status.getBudget().getRemaining(), 1e-9);
    assertEquals(100, status.getBudget().getMax(), 1e-9);
  }

  @Test
  void queriesAtTheNextFiveMinuteBoundary() {
    stubQueries(vector(sample(API, 1)), vector());

    aggregator.status(OBJECTIVE).blockingGet();

    verify(prometheusClient).query(OBJECTIVE.queryTotal(OBJECTIVE.getWindow()), ROUNDED);
    verify(prometheusClient).query(OBJECTIVE.queryErrors(OBJECTIVE.getWindow()), ROUNDED);
  }

  @Test
  void dropsSeriesWithoutRequests() {
    stubQueries(vector(sample(API, 100), sample(HEALTH, 0)), vector(sample(HEALTH, 0)));

    List<ObjectiveStatus> statuses = aggregator.status(OBJECTIVE).blockingGet();

    assertEquals(1, statuses.size());
    assertEquals("/api", statuses.get(0).getLabels().get("handler"));
  }

  @Test
  void dropsErrorsWithoutTotals() {
    stubQueries(vector(sample(API, 100)), vector(sample(ADMIN, 7)));

    List<ObjectiveStatus> statuses = aggregator.status(OBJECTIVE).blockingGet();

    assertEquals(1, statuses.size());
    assertEquals(0, statuses.get(0).getAvailability().getErrors());
    assertEquals(1, statuses.get(0).getAvailability().getPercentage());
    assertEquals(1, statuses.get(0).getBudget().getRemaining(), 1e-9);
  }

  @Test
  void neverReportsNaN() {
    stubQueries(vector(sample(API, Double.NaN)), vector(sample(API, Double.NaN)));

    ObjectiveStatus status = aggregator.status(OBJECTIVE).blockingGet().get(0);

    assertEquals(1, status.getAvailability().getPercentage());
    assertEquals(1, status.getBudget().getRemaining());
    assertFalse(Double.isNaN(status.getBudget().getTotal()));
  }

  @Test
  void keepsTheOrderOfTheTotalQuery() {
    stubQueries(vector(sample(HEALTH, 5), sample(API, 10), sample(ADMIN, 1)), vector());

    List<ObjectiveStatus> statuses = aggregator.status(OBJECTIVE).blockingGet();

    assertEquals(3, statuses.size());
    assertEquals("/health", statuses.get(0).getLabels().get("handler"));
    assertEquals("/api", statuses.get(1).getLabels().get("handler"));
    assertEquals("/admin", statuses.get(2).getLabels().get("handler"));
  }

  @Test
  void failsOnNonVectorResults() {
    when(prometheusClient.query(anyString(), eq(ROUNDED)))
        .thenReturn(Single.just(QueryResult.of(new MatrixValue(List.of()))));

    aggregator.status(OBJECTIVE).test().assertError(UnexpectedResultTypeException.class);
  }

  @Test
  void roundsUpToTheInterval() {
    Duration interval = Duration.ofMinutes(5);
    assertEquals(
        ROUNDED, StatusAggregator.roundUp(Instant.parse("2023-05-01T10:00:00.001Z"), interval));
    assertEquals(ROUNDED, StatusAggregator.roundUp(ROUNDED, interval));
    assertTrue(StatusAggregator.roundUp(NOW, interval).isAfter(NOW));
  }

  private void stubQueries(VectorValue totals, VectorValue errors) {
    when(prometheusClient.query(OBJECTIVE.queryTotal(OBJECTIVE.getWindow()), ROUNDED))
        .thenReturn(Single.just(QueryResult.of(totals)));
    when(prometheusClient.query(OBJECTIVE.queryErrors(OBJECTIVE.getWindow()), ROUNDED))
        .thenReturn(Single.just(QueryResult.of(errors)));
  }

  private static VectorValue vector(Sample... samples) {
    return new VectorValue(List.of(samples));
  }

  private static Sample sample(Labels labels, double value) {
    return new Sample(labels, ROUNDED.toEpochMilli(), value);
  }
}
