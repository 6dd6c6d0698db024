package org.hypertrace.slo.service.range;

import io.reactivex.rxjava3.core.Single;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.slo.service.api.Objective;
import org.hypertrace.slo.service.api.ObjectivesServiceException;
import org.hypertrace.slo.service.api.QueryRangeResult;
import org.hypertrace.slo.service.prometheus.MatrixValue;
import org.hypertrace.slo.service.prometheus.PrometheusClient;
import org.hypertrace.slo.service.prometheus.QueryValues;

/** Error budget, request rate and error rate of an objective over time. */
@Slf4j
public class RangeQueryService {
  private final PrometheusClient prometheusClient;
  private final RangeQueryPlanner planner;

  @Inject
  public RangeQueryService(PrometheusClient prometheusClient, RangeQueryPlanner planner) {
    this.prometheusClient = prometheusClient;
    this.planner = planner;
  }

  public Single<QueryRangeResult> errorBudget(
      Objective objective, Optional<Instant> start, Optional<Instant> end) {
    return Single.defer(
        () -> query(objective.queryErrorBudget(), planner.plan(start, end), false));
  }

  public Single<QueryRangeResult> requests(
      Objective objective, Optional<Instant> start, Optional<Instant> end) {
    return Single.defer(
        () -> {
          RangeQueryPlan plan = planner.plan(start, end);
          return query(objective.requestRange(plan.getTimeRange()), plan, true);
        });
  }

  public Single<QueryRangeResult> errors(
      Objective objective, Optional<Instant> start, Optional<Instant> end) {
    return Single.defer(
        () -> {
          RangeQueryPlan plan = planner.plan(start, end);
          return query(objective.errorsRange(plan.getTimeRange()), plan, true);
        });
  }

  private Single<QueryRangeResult> query(String query, RangeQueryPlan plan, boolean withLabels) {
    log.debug(
        "Querying range {} - {} step {}: {}",
        plan.getStart(),
        plan.getEnd(),
        plan.getStep(),
        query);
    return prometheusClient
        .queryRange(query, plan.toQueryRange())
        .map(
            result -> {
              MatrixValue matrix = QueryValues.requireMatrix(result.getValue());
              if (matrix.isEmpty()) {
                throw ObjectivesServiceException.notFound("No data returned for " + query);
              }
              List<String> labels =
                  withLabels
                      ? matrix.getStreams().stream()
                          .map(stream -> stream.getMetric().toString())
                          .collect(Collectors.toUnmodifiableList())
                      : List.of();
              return QueryRangeResult.builder()
                  .query(query)
                  .labels(labels)
                  .values(MatrixTransformer.toColumns(matrix))
                  .build();
            });
  }
}
