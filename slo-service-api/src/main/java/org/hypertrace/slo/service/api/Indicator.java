package org.hypertrace.slo.service.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Exactly one of {@link #getRatio()} and {@link #getLatency()} is set. */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Indicator {
  RatioIndicator ratio;
  LatencyIndicator latency;

  @JsonIgnore
  public boolean isRatio() {
    return ratio != null;
  }

  @JsonIgnore
  public boolean isLatency() {
    return latency != null;
  }

  /** The metric counting every event, whichever indicator kind is populated. */
  @JsonIgnore
  public Metric getTotal() {
    if (ratio != null) {
      return ratio.getTotal();
    }
    if (latency != null) {
      return latency.getTotal();
    }
    throw new IllegalStateException("Indicator has neither a ratio nor a latency definition");
  }

  @JsonIgnore
  public List<String> getGrouping() {
    if (ratio != null) {
      return ratio.getGrouping();
    }
    if (latency != null) {
      return latency.getGrouping();
    }
    return List.of();
  }
}
