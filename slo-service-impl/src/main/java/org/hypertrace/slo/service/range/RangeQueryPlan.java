package org.hypertrace.slo.service.range;

import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.hypertrace.slo.service.prometheus.QueryRange;

@Value
@Builder
public class RangeQueryPlan {
  @NonNull Instant start;
  @NonNull Instant end;

  /** Resolution of the returned samples. */
  @NonNull Duration step;

  /** Window of the rate functions inside the query. */
  @NonNull Duration timeRange;

  public QueryRange toQueryRange() {
    return QueryRange.builder().start(start).end(end).step(step).build();
  }
}
