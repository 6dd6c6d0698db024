package org.hypertrace.slo.service;

import static com.google.common.base.Strings.nullToEmpty;

import io.reactivex.rxjava3.core.Single;
import java.io.Closeable;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.slo.service.alerts.BurnrateEvaluator;
import org.hypertrace.slo.service.api.MultiBurnrateAlert;
import org.hypertrace.slo.service.api.Objective;
import org.hypertrace.slo.service.api.ObjectiveStatus;
import org.hypertrace.slo.service.api.ObjectivesApi;
import org.hypertrace.slo.service.api.ObjectivesServiceException;
import org.hypertrace.slo.service.api.QueryRangeResult;
import org.hypertrace.slo.service.objectives.GroupingMerger;
import org.hypertrace.slo.service.objectives.GroupingMerger.Mode;
import org.hypertrace.slo.service.objectives.ObjectiveResolver;
import org.hypertrace.slo.service.range.RangeQueryService;
import org.hypertrace.slo.service.status.StatusAggregator;

/**
 * Entry point of the service. Every failure is reported as an {@link ObjectivesServiceException}
 * whose status tells client errors from server errors.
 */
@Singleton
@Slf4j
public class ObjectivesServiceImpl implements ObjectivesApi, Closeable {

  private final ObjectiveResolver objectiveResolver;
  private final StatusAggregator statusAggregator;
  private final BurnrateEvaluator burnrateEvaluator;
  private final RangeQueryService rangeQueryService;
  private final Set<Closeable> resources;

  @Inject
  public ObjectivesServiceImpl(
      ObjectiveResolver objectiveResolver,
      StatusAggregator statusAggregator,
      BurnrateEvaluator burnrateEvaluator,
      RangeQueryService rangeQueryService,
      Set<Closeable> resources) {
    this.objectiveResolver = objectiveResolver;
    this.statusAggregator = statusAggregator;
    this.burnrateEvaluator = burnrateEvaluator;
    this.rangeQueryService = rangeQueryService;
    this.resources = resources;
  }

  @Override
  public Single<List<Objective>> listObjectives(String expr) {
    return objectiveResolver.resolve(nullToEmpty(expr)).onErrorResumeNext(this::toServiceException);
  }

  @Override
  public Single<List<ObjectiveStatus>> getObjectiveStatus(String expr, String grouping) {
    return resolveMerged(expr, grouping, Mode.PRUNE_PINNED)
        .flatMap(statusAggregator::status)
        .onErrorResumeNext(this::toServiceException);
  }

  @Override
  public Single<QueryRangeResult> getObjectiveErrorBudget(
      String expr, String grouping, Optional<Instant> start, Optional<Instant> end) {
    return queryRange(
        expr, grouping, objective -> rangeQueryService.errorBudget(objective, start, end));
  }

  @Override
  public Single<List<MultiBurnrateAlert>> getMultiBurnrateAlerts(String expr, String grouping) {
    return resolveMerged(expr, grouping, Mode.COLLAPSE)
        .flatMap(burnrateEvaluator::evaluate)
        .onErrorResumeNext(this::toServiceException);
  }

  @Override
  public Single<QueryRangeResult> getREDRequests(
      String expr, String grouping, Optional<Instant> start, Optional<Instant> end) {
    return queryRange(
        expr, grouping, objective -> rangeQueryService.requests(objective, start, end));
  }

  @Override
  public Single<QueryRangeResult> getREDErrors(
      String expr, String grouping, Optional<Instant> start, Optional<Instant> end) {
    return queryRange(
        expr, grouping, objective -> rangeQueryService.errors(objective, start, end));
  }

  private Single<QueryRangeResult> queryRange(
      String expr,
      String grouping,
      Function<Objective, Single<QueryRangeResult>> rangeQuery) {
    return resolveMerged(expr, grouping, Mode.PRUNE_PINNED)
        .flatMap(rangeQuery::apply)
        .onErrorResumeNext(this::toServiceException);
  }

  private Single<Objective> resolveMerged(String expr, String grouping, Mode mode) {
    return objectiveResolver
        .resolveOne(nullToEmpty(expr))
        .map(objective -> GroupingMerger.merge(objective, grouping, mode));
  }

  private <T> Single<T> toServiceException(Throwable throwable) {
    if (throwable instanceof ObjectivesServiceException) {
      return Single.error(throwable);
    }
    log.error("Request failed", throwable);
    return Single.error(
        ObjectivesServiceException.internal(String.valueOf(throwable.getMessage()), throwable));
  }

  /** Cancels in flight backend calls and drops cached results. */
  @Override
  public void close() {
    for (Closeable resource : resources) {
      try {
        resource.close();
      } catch (IOException e) {
        log.warn("Failed to close {}", resource, e);
      }
    }
  }
}
