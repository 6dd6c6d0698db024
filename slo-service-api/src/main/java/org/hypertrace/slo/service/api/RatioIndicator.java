package org.hypertrace.slo.service.api;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Ratio of failing to total events, e.g. HTTP 5xx responses over all responses. */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RatioIndicator {
  @NonNull Metric errors;
  @NonNull Metric total;
  @Builder.Default List<String> grouping = List.of();
}
