package org.hypertrace.slo.service.objectives;

import io.reactivex.rxjava3.core.Single;
import java.util.List;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.slo.service.api.Objective;
import org.hypertrace.slo.service.api.ObjectivesServiceException;
import org.hypertrace.slo.service.api.promql.InvalidSelectorException;
import org.hypertrace.slo.service.api.promql.MetricSelectorParser;

/**
 * Looks up objectives by a label selector. Malformed selectors are rejected before the store is
 * contacted, store failures are translated into {@link ObjectivesServiceException}s.
 */
@Slf4j
public class ObjectiveResolver {
  private final ObjectiveStoreClient storeClient;

  @Inject
  public ObjectiveResolver(ObjectiveStoreClient storeClient) {
    this.storeClient = storeClient;
  }

  public Single<List<Objective>> resolve(String expr) {
    return Single.defer(
        () -> {
          validate(expr);
          return storeClient
              .listObjectives(expr)
              .onErrorResumeNext(throwable -> Single.error(translate(expr, throwable)));
        });
  }

  /** Resolves {@code expr} to the single objective it has to match. */
  public Single<Objective> resolveOne(String expr) {
    return resolve(expr)
        .map(
            objectives -> {
              if (objectives.size() != 1) {
                throw ObjectivesServiceException.invalidArgument(
                    "expr matches not exactly one SLO, it matches: " + objectives.size());
              }
              return objectives.get(0);
            });
  }

  private static void validate(String expr) {
    if (expr.isEmpty()) {
      return;
    }
    try {
      MetricSelectorParser.parse(expr);
    } catch (InvalidSelectorException e) {
      throw ObjectivesServiceException.invalidArgument(e.getMessage(), e);
    }
  }

  private static Throwable translate(String expr, Throwable throwable) {
    if (throwable instanceof ObjectivesServiceException) {
      return throwable;
    }
    if (throwable instanceof ObjectiveStoreException
        && ((ObjectiveStoreException) throwable).isNotFound()) {
      return ObjectivesServiceException.notFound("No objective found for " + expr);
    }
    log.error("Failed to list objectives for {}", expr, throwable);
    return ObjectivesServiceException.internal(
        "Failed to list objectives: " + throwable.getMessage(), throwable);
  }
}
