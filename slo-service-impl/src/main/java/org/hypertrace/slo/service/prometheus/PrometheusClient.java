package org.hypertrace.slo.service.prometheus;

import io.reactivex.rxjava3.core.Single;
import java.time.Instant;

/**
 * Query API of the metrics backend. Calls are lazy: nothing is sent before subscription, and
 * disposing the subscription cancels the call in flight.
 */
public interface PrometheusClient {

  Single<QueryResult> query(String query, Instant time);

  Single<QueryResult> queryRange(String query, QueryRange range);
}
