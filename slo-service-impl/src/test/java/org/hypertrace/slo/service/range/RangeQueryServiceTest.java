package org.hypertrace.slo.service.range;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
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
import java.util.Optional;
import org.hypertrace.slo.service.api.Indicator;
import org.hypertrace.slo.service.api.Metric;
import org.hypertrace.slo.service.api.Objective;
import org.hypertrace.slo.service.api.ObjectivesServiceException;
import org.hypertrace.slo.service.api.ObjectivesServiceException.Status;
import org.hypertrace.slo.service.api.QueryRangeResult;
import org.hypertrace.slo.service.api.RatioIndicator;
import org.hypertrace.slo.service.prometheus.Labels;
import org.hypertrace.slo.service.prometheus.MatrixValue;
import org.hypertrace.slo.service.prometheus.PrometheusClient;
import org.hypertrace.slo.service.prometheus.QueryRange;
import org.hypertrace.slo.service.prometheus.QueryResult;
import org.hypertrace.slo.service.prometheus.SamplePair;
import org.hypertrace.slo.service.prometheus.SampleStream;
import org.hypertrace.slo.service.prometheus.UnexpectedResultTypeException;
import org.hypertrace.slo.service.prometheus.VectorValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RangeQueryServiceTest {
  private static final Instant END = Instant.parse("2023-05-01T10:00:00Z");
  private static final Instant START = END.minus(Duration.ofHours(2));

  private static final Objective OBJECTIVE =
      Objective.builder()
          .labels(Map.of("__name__", "api"))
          .target(0.99)
          .window(Duration.ofDays(28))
          .indicator(
              Indicator.builder()
                  .ratio(
                      RatioIndicator.builder()
                          .errors(Metric.parse("http_requests_total{code=~\"5..\"}"))
                          .total(Metric.parse("http_requests_total"))
                          .build())
                  .build())
          .build();

  private static final MatrixValue MATRIX =
      new MatrixValue(
          List.of(
              SampleStream.builder()
                  .metric(Labels.of(Map.of("code", "200")))
                  .value(new SamplePair(START.toEpochMilli(), 4))
                  .build(),
              SampleStream.builder()
                  .metric(Labels.of(Map.of("code", "500")))
                  .value(new SamplePair(END.toEpochMilli(), 1))
                  .build()));

  @Mock private PrometheusClient prometheusClient;
  private RangeQueryService service;

  @BeforeEach
  void setUp() {
    service =
        new RangeQueryService(
            prometheusClient, new RangeQueryPlanner(Clock.fixed(END, ZoneOffset.UTC)));
  }

  @Test
  void queriesRequestsWithPlannedRange() {
    String query = OBJECTIVE.requestRange(Duration.ofMinutes(5));
    QueryRange range =
        QueryRange.builder().start(START).end(END).step(Duration.ofMillis(7200)).build();
    when(prometheusClient.queryRange(query, range))
        .thenReturn(Single.just(QueryResult.of(MATRIX)));

    QueryRangeResult result =
        service.requests(OBJECTIVE, Optional.of(START), Optional.of(END)).blockingGet();

    assertEquals(query, result.getQuery());
    assertEquals(List.of("{code=\"200\"}", "{code=\"500\"}"), result.getLabels());
    assertArrayEquals(
        new double[] {START.getEpochSecond(), END.getEpochSecond()}, result.getValues()[0]);
    assertArrayEquals(new double[] {4, 0}, result.getValues()[1]);
  }

  @Test
  void queriesErrorsWithPlannedTimeRange() {
    when(prometheusClient.queryRange(anyString(), any()))
        .thenReturn(Single.just(QueryResult.of(MATRIX)));

    service
        .errors(OBJECTIVE, Optional.of(END.minus(Duration.ofDays(30))), Optional.of(END))
        .blockingGet();

    verify(prometheusClient).queryRange(eq(OBJECTIVE.errorsRange(Duration.ofHours(3))), any());
  }

  @Test
  void reportsErrorBudgetWithoutLabels() {
    when(prometheusClient.queryRange(eq(OBJECTIVE.queryErrorBudget()), any()))
        .thenReturn(Single.just(QueryResult.of(MATRIX)));

    QueryRangeResult result =
        service.errorBudget(OBJECTIVE, Optional.empty(), Optional.empty()).blockingGet();

    assertEquals(List.of(), result.getLabels());
    assertEquals(3, result.getValues().length);
  }

  @Test
  void reportsNotFoundForEmptyMatrix() {
    when(prometheusClient.queryRange(anyString(), any()))
        .thenReturn(Single.just(QueryResult.of(new MatrixValue(List.of()))));

    service
        .requests(OBJECTIVE, Optional.empty(), Optional.empty())
        .test()
        .assertError(
            error ->
                error instanceof ObjectivesServiceException
                    && ((ObjectivesServiceException) error).getStatus() == Status.NOT_FOUND);
  }

  @Test
  void failsOnNonMatrixResult() {
    when(prometheusClient.queryRange(anyString(), any()))
        .thenReturn(Single.just(QueryResult.of(new VectorValue(List.of()))));

    service
        .errorBudget(OBJECTIVE, Optional.empty(), Optional.empty())
        .test()
        .assertError(UnexpectedResultTypeException.class);
  }

  @Test
  void rejectsStartAfterEnd() {
    service
        .requests(OBJECTIVE, Optional.of(END), Optional.of(START))
        .test()
        .assertError(ObjectivesServiceException.class);
  }
}
