package org.hypertrace.slo.service.prometheus;

import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class QueryRange {
  @NonNull Instant start;
  @NonNull Instant end;

  /*
   * It refers to the step query param argument of PromQL range query Rest API.
   * https://prometheus.io/docs/prometheus/latest/querying/api/#range-queries
   * */
  @NonNull Duration step;
}
