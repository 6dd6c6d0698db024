package org.hypertrace.slo.service.objectives;

import io.reactivex.rxjava3.core.Single;
import java.util.List;
import org.hypertrace.slo.service.api.Objective;

/** Read access to the service holding the objective definitions. */
public interface ObjectiveStoreClient {

  /**
   * Lists the objectives whose labels match {@code expr}, every objective for an empty expression.
   * Fails with an {@link ObjectiveStoreException} when the store answers with an error.
   */
  Single<List<Objective>> listObjectives(String expr);
}
