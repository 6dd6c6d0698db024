package org.hypertrace.slo.service.api;

import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Availability and error budget of one series of an objective. */
@Value
@Builder
public class ObjectiveStatus {
  @NonNull Map<String, String> labels;
  @NonNull Availability availability;
  @NonNull Budget budget;

  @Value
  @Builder
  public static class Availability {
    double percentage;
    double total;
    double errors;
  }

  /**
   * {@code remaining} is relative to {@code total}: 1 is the full budget, 0 is exhausted and
   * negative values are over budget. {@code max} is the number of events allowed to fail.
   */
  @Value
  @Builder
  public static class Budget {
    double total;
    double remaining;
    double max;
  }
}
