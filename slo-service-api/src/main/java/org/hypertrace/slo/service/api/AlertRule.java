package org.hypertrace.slo.service.api;

import java.time.Duration;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** One multi-window burn rate alert derived from an objective. */
@Value
@Builder
public class AlertRule {
  @NonNull String severity;
  @NonNull Duration forDuration;
  double factor;
  @NonNull Duration shortWindow;
  @NonNull Duration longWindow;
  @NonNull String queryShort;
  @NonNull String queryLong;
}
