package org.hypertrace.slo.service.api.promql;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.hypertrace.slo.service.api.AlertRule;
import org.hypertrace.slo.service.api.Indicator;
import org.hypertrace.slo.service.api.LatencyIndicator;
import org.hypertrace.slo.service.api.Metric;
import org.hypertrace.slo.service.api.Objective;
import org.hypertrace.slo.service.api.RatioIndicator;
import org.junit.jupiter.api.Test;

class ObjectiveQueriesTest {
  private static final Objective RATIO =
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
                          .grouping(List.of("handler"))
                          .build())
                  .build())
          .build();

  private static final Objective LATENCY =
      Objective.builder()
          .labels(Map.of("__name__", "api-latency"))
          .target(0.95)
          .window(Duration.ofDays(7))
          .indicator(
              Indicator.builder()
                  .latency(
                      LatencyIndicator.builder()
                          .success(
                              Metric.parse("http_request_duration_seconds_bucket{le=\"0.5\"}"))
                          .total(Metric.parse("http_request_duration_seconds_count"))
                          .build())
                  .build())
          .build();

  @Test
  void queriesRatioIncreaseRecordingRules() {
    assertEquals(
        "sum by(handler) (http_requests:increase4w{slo=\"api\"})",
        RATIO.queryTotal(RATIO.getWindow()));
    assertEquals(
        "sum by(handler) (http_requests:increase4w{code=~\"5..\", slo=\"api\"})",
        RATIO.queryErrors(RATIO.getWindow()));
  }

  @Test
  void derivesLatencyErrorsFromSuccess() {
    assertEquals(
        "sum(http_request_duration_seconds:increase1w{slo=\"api-latency\"})"
            + " - sum(http_request_duration_seconds:increase1w{le=\"0.5\", slo=\"api-latency\"})",
        LATENCY.queryErrors(LATENCY.getWindow()));
  }

  @Test
  void queriesUngroupedErrorBudget() {
    assertEquals(
        "((1 - 0.99) - ((sum(http_requests:increase4w{code=~\"5..\", slo=\"api\"}) or vector(0))"
            + " / sum(http_requests:increase4w{slo=\"api\"}))) / (1 - 0.99)",
        RATIO.queryErrorBudget());
  }

  @Test
  void groupsRatioRangeQueriesByCode() {
    assertEquals(
        "sum by(handler, code) (rate(http_requests_total{}[5m])) > 0",
        RATIO.requestRange(Duration.ofMinutes(5)));
    assertEquals(
        "sum by(handler, code) (rate(http_requests_total{code=~\"5..\"}[5m]))"
            + " / scalar(sum(rate(http_requests_total{}[5m]))) > 0",
        RATIO.errorsRange(Duration.ofMinutes(5)));
  }

  @Test
  void queriesLatencyErrorRatio() {
    String total = "sum(rate(http_request_duration_seconds_count{}[1h]))";
    assertEquals(
        "("
            + total
            + " - sum(rate(http_request_duration_seconds_bucket{le=\"0.5\"}[1h]))) / "
            + total
            + " > 0",
        LATENCY.errorsRange(Duration.ofHours(1)));
  }

  @Test
  void scalesAlertWindowsWithObjectiveWindow() {
    List<AlertRule> rules = RATIO.alerts();

    assertEquals(4, rules.size());
    AlertRule fast = rules.get(0);
    assertEquals("critical", fast.getSeverity());
    assertEquals(14, fast.getFactor());
    assertEquals(Duration.ofMinutes(2), fast.getForDuration());
    assertEquals(Duration.ofMinutes(5), fast.getShortWindow());
    assertEquals(Duration.ofHours(1), fast.getLongWindow());
    assertEquals("http_requests:burnrate5m{slo=\"api\"}", fast.getQueryShort());
    assertEquals("http_requests:burnrate1h{slo=\"api\"}", fast.getQueryLong());

    AlertRule slow = rules.get(3);
    assertEquals("warning", slow.getSeverity());
    assertEquals(Duration.ofHours(6), slow.getForDuration());
    assertEquals(Duration.ofDays(1), slow.getShortWindow());
    assertEquals(Duration.ofDays(4), slow.getLongWindow());
  }

  @Test
  void stripsCounterSuffixes() {
    assertEquals("http_requests", ObjectiveQueries.baseName("http_requests_total"));
    assertEquals("latency_seconds", ObjectiveQueries.baseName("latency_seconds_bucket"));
    assertEquals("up", ObjectiveQueries.baseName("up"));
  }

  @Test
  void roundsToNearestMinute() {
    assertEquals(Duration.ofMinutes(2), ObjectiveQueries.roundToMinute(Duration.ofSeconds(90)));
    assertEquals(Duration.ofMinutes(1), ObjectiveQueries.roundToMinute(Duration.ofSeconds(89)));
    assertEquals("0.999", ObjectiveQueries.formatNumber(0.999));
  }
}
