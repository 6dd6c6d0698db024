package org.hypertrace.slo.service.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class MultiBurnrateAlert {
  @NonNull String severity;

  /** Pending duration in milliseconds. */
  @JsonProperty("for")
  long forDuration;

  double factor;

  @JsonProperty("short")
  @NonNull
  Burnrate shortBurnrate;

  @JsonProperty("long")
  @NonNull
  Burnrate longBurnrate;

  @NonNull AlertState state;
}
