package org.hypertrace.slo.service.api;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class Burnrate {
  /** Marks a burn rate that could not be measured. */
  public static final double UNAVAILABLE = -1;

  /** Window in milliseconds. */
  long window;

  @Builder.Default double current = UNAVAILABLE;
  @NonNull String query;
}
