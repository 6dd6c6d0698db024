package org.hypertrace.slo.service.alerts;

import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Single;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.slo.service.api.AlertRule;
import org.hypertrace.slo.service.api.AlertState;
import org.hypertrace.slo.service.api.Burnrate;
import org.hypertrace.slo.service.api.LabelMatcher;
import org.hypertrace.slo.service.api.MultiBurnrateAlert;
import org.hypertrace.slo.service.api.Objective;
import org.hypertrace.slo.service.api.promql.PromDuration;
import org.hypertrace.slo.service.prometheus.PrometheusClient;
import org.hypertrace.slo.service.prometheus.QueryResult;
import org.hypertrace.slo.service.prometheus.QueryValues;
import org.hypertrace.slo.service.prometheus.Sample;
import org.hypertrace.slo.service.prometheus.VectorValue;

/**
 * Evaluates the multi-window burn rate alerts of an objective. Every rule issues its short window,
 * long window and alert state queries concurrently and is assembled once all three completed. A
 * failing query only degrades its own value: burn rates stay {@link Burnrate#UNAVAILABLE} and the
 * state stays {@link AlertState#INACTIVE}.
 */
@Slf4j
public class BurnrateEvaluator {
  static final String ALERTS_METRIC = "ALERTS";
  static final String ALERT_STATE_LABEL = "alertstate";

  private final PrometheusClient prometheusClient;
  private final Clock clock;

  @Inject
  public BurnrateEvaluator(PrometheusClient prometheusClient, Clock clock) {
    this.prometheusClient = prometheusClient;
    this.clock = clock;
  }

  /** Results come in the order of {@link Objective#alerts()}. */
  public Single<List<MultiBurnrateAlert>> evaluate(Objective objective) {
    return Single.defer(
        () ->
            Observable.fromIterable(objective.alerts())
                .concatMapSingle(rule -> evaluate(objective.getName(), rule))
                .toList());
  }

  Single<MultiBurnrateAlert> evaluate(String objectiveName, AlertRule rule) {
    Burnrate shortBurnrate =
        Burnrate.builder()
            .window(rule.getShortWindow().toMillis())
            .query(rule.getQueryShort())
            .build();
    Burnrate longBurnrate =
        Burnrate.builder()
            .window(rule.getLongWindow().toMillis())
            .query(rule.getQueryLong())
            .build();
    return Single.zip(
        currentBurnrate(shortBurnrate.getQuery()),
        currentBurnrate(longBurnrate.getQuery()),
        alertState(alertsQuery(objectiveName, rule)),
        (shortCurrent, longCurrent, state) ->
            MultiBurnrateAlert.builder()
                .severity(rule.getSeverity())
                .forDuration(rule.getForDuration().toMillis())
                .factor(rule.getFactor())
                .shortBurnrate(shortBurnrate.toBuilder().current(shortCurrent).build())
                .longBurnrate(longBurnrate.toBuilder().current(longCurrent).build())
                .state(state)
                .build());
  }

  private Single<Double> currentBurnrate(String query) {
    return prometheusClient
        .query(query, clock.instant())
        .map(
            result ->
                singleSample(query, result).map(Sample::getValue).orElse(Burnrate.UNAVAILABLE))
        .onErrorReturn(
            throwable -> {
              log.warn("Burn rate query {} failed", query, throwable);
              return Burnrate.UNAVAILABLE;
            });
  }

  private Single<AlertState> alertState(String query) {
    return prometheusClient
        .query(query, clock.instant())
        .map(
            result ->
                singleSample(query, result)
                    .map(BurnrateEvaluator::stateOf)
                    .orElse(AlertState.INACTIVE))
        .onErrorReturn(
            throwable -> {
              log.warn("Alert state query {} failed", query, throwable);
              return AlertState.INACTIVE;
            });
  }

  /** Only an active alert sample, value 1, carries a meaningful state label. */
  static AlertState stateOf(Sample sample) {
    if (sample.getValue() != 1) {
      log.debug("Alert {} is not pending or firing", sample.getMetric());
      return AlertState.INACTIVE;
    }
    return sample
        .getMetric()
        .get(ALERT_STATE_LABEL)
        .flatMap(AlertState::fromValue)
        .orElse(AlertState.INACTIVE);
  }

  private static Optional<Sample> singleSample(String query, QueryResult result) {
    Optional<VectorValue> vector = QueryValues.asVector(result.getValue());
    if (vector.isEmpty()) {
      log.warn(
          "Query {} returned a {} instead of a vector",
          query,
          result.getValue().getResultType().getName());
      return Optional.empty();
    }
    if (vector.get().size() != 1) {
      return Optional.empty();
    }
    return Optional.of(vector.get().getSamples().get(0));
  }

  static String alertsQuery(String objectiveName, AlertRule rule) {
    return Stream.of(
            LabelMatcher.equal("slo", objectiveName),
            LabelMatcher.equal("short", PromDuration.format(rule.getShortWindow())),
            LabelMatcher.equal("long", PromDuration.format(rule.getLongWindow())))
        .map(LabelMatcher::toString)
        .collect(Collectors.joining(",", ALERTS_METRIC + "{", "}"));
  }
}
