package org.hypertrace.slo.service.api;

import io.reactivex.rxjava3.core.Single;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read API backing the objectives dashboard. {@code expr} is a label selector over the objective
 * labels, {@code grouping} an optional label selector that narrows the indicator queries. Failures
 * are signalled with {@link ObjectivesServiceException}.
 *
 * <p>All operations except {@link #listObjectives(String)} require {@code expr} to match exactly
 * one objective. Range operations default to the last hour unless both bounds are given.
 */
public interface ObjectivesApi {

  Single<List<Objective>> listObjectives(String expr);

  Single<List<ObjectiveStatus>> getObjectiveStatus(String expr, String grouping);

  Single<QueryRangeResult> getObjectiveErrorBudget(
      String expr, String grouping, Optional<Instant> start, Optional<Instant> end);

  Single<List<MultiBurnrateAlert>> getMultiBurnrateAlerts(String expr, String grouping);

  Single<QueryRangeResult> getREDRequests(
      String expr, String grouping, Optional<Instant> start, Optional<Instant> end);

  Single<QueryRangeResult> getREDErrors(
      String expr, String grouping, Optional<Instant> start, Optional<Instant> end);
}
