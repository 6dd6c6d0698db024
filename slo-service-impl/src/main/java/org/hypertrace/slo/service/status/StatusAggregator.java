package org.hypertrace.slo.service.status;

import io.reactivex.rxjava3.core.Single;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.slo.service.api.Objective;
import org.hypertrace.slo.service.api.ObjectiveStatus;
import org.hypertrace.slo.service.prometheus.PrometheusClient;
import org.hypertrace.slo.service.prometheus.QueryValues;
import org.hypertrace.slo.service.prometheus.Sample;
import org.hypertrace.slo.service.prometheus.VectorValue;

/**
 * Computes availability and remaining error budget per series of an objective from its total and
 * errors queries over the objective window.
 */
@Slf4j
public class StatusAggregator {
  static final Duration EVALUATION_INTERVAL = Duration.ofMinutes(5);

  private final PrometheusClient prometheusClient;
  private final Clock clock;

  @Inject
  public StatusAggregator(PrometheusClient prometheusClient, Clock clock) {
    this.prometheusClient = prometheusClient;
    this.clock = clock;
  }

  public Single<List<ObjectiveStatus>> status(Objective objective) {
    return Single.defer(
        () -> {
          // identical evaluation times within one interval share cache entries
          Instant time = roundUp(clock.instant(), EVALUATION_INTERVAL);
          String queryTotal = objective.queryTotal(objective.getWindow());
          String queryErrors = objective.queryErrors(objective.getWindow());
          log.debug("Querying status of {} at {}: {}", objective.getName(), time, queryTotal);
          return query(queryTotal, time)
              .flatMap(
                  totals -> {
                    log.debug("Querying errors of {}: {}", objective.getName(), queryErrors);
                    return query(queryErrors, time)
                        .map(errors -> aggregate(objective.getTarget(), totals, errors));
                  });
        });
  }

  private Single<VectorValue> query(String query, Instant time) {
    return prometheusClient
        .query(query, time)
        .map(result -> QueryValues.requireVector(result.getValue()));
  }

  static List<ObjectiveStatus> aggregate(double target, VectorValue totals, VectorValue errors) {
    Map<Long, SeriesStatus> statuses = new LinkedHashMap<>();
    for (Sample sample : totals.getSamples()) {
      statuses.put(sample.getMetric().fingerprint(), new SeriesStatus(sample));
    }
    for (Sample sample : errors.getSamples()) {
      SeriesStatus status = statuses.get(sample.getMetric().fingerprint());
      if (status == null) {
        log.debug("Dropping errors of {} without a matching total", sample.getMetric());
        continue;
      }
      status.errors = sample.getValue();
    }

    double budgetTotal = 1 - target;
    return statuses.values().stream()
        // series without any requests are not reported
        .filter(status -> status.total != 0)
        .map(status -> status.toObjectiveStatus(budgetTotal))
        .collect(Collectors.toUnmodifiableList());
  }

  /** Rounds up to the next multiple of {@code interval} since the epoch, boundaries stay. */
  static Instant roundUp(Instant time, Duration interval) {
    long seconds = time.getEpochSecond();
    Instant floor = Instant.ofEpochSecond(seconds - Math.floorMod(seconds, interval.getSeconds()));
    return floor.equals(time) ? time : floor.plus(interval);
  }

  private static class SeriesStatus {
    private final Map<String, String> labels;
    private final double total;
    private double errors;

    private SeriesStatus(Sample totalSample) {
      this.labels = totalSample.getMetric().asMap();
      this.total = totalSample.getValue();
    }

    private ObjectiveStatus toObjectiveStatus(double budgetTotal) {
      double percentage = 1 - errors / total;
      double remaining = (budgetTotal - errors / total) / budgetTotal;
      return ObjectiveStatus.builder()
          .labels(labels)
          .availability(
              ObjectiveStatus.Availability.builder()
                  .percentage(Double.isNaN(percentage) ? 1 : percentage)
                  .total(total)
                  .errors(errors)
                  .build())
          .budget(
              ObjectiveStatus.Budget.builder()
                  .total(budgetTotal)
                  .remaining(Double.isNaN(remaining) ? 1 : remaining)
                  .max(budgetTotal * total)
                  .build())
          .build();
    }
  }
}
