package org.hypertrace.slo.service.api;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Histogram backed indicator: requests faster than a bucket boundary over all requests. */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LatencyIndicator {
  @NonNull Metric success;
  @NonNull Metric total;
  @Builder.Default List<String> grouping = List.of();
}
