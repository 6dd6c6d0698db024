package org.hypertrace.slo.service.range;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import javax.inject.Inject;
import org.hypertrace.slo.service.api.ObjectivesServiceException;

/**
 * Chooses step and rate window for charting queries so that a chart holds about the same number
 * of points whatever the requested span.
 */
public class RangeQueryPlanner {
  static final Duration DEFAULT_SPAN = Duration.ofHours(1);
  static final int TARGET_POINTS = 1000;
  private static final Duration MIN_STEP = Duration.ofMillis(1);

  private final Clock clock;

  @Inject
  public RangeQueryPlanner(Clock clock) {
    this.clock = clock;
  }

  /** Plans the last hour unless both bounds are given. */
  public RangeQueryPlan plan(Optional<Instant> start, Optional<Instant> end) {
    Instant planEnd;
    Instant planStart;
    if (start.isPresent() && end.isPresent()) {
      planStart = start.get();
      planEnd = end.get();
    } else {
      planEnd = clock.instant();
      planStart = planEnd.minus(DEFAULT_SPAN);
    }
    if (planStart.isAfter(planEnd)) {
      throw ObjectivesServiceException.invalidArgument(
          "start " + planStart + " is after end " + planEnd);
    }
    Duration span = Duration.between(planStart, planEnd);
    Duration step = span.dividedBy(TARGET_POINTS);
    return RangeQueryPlan.builder()
        .start(planStart)
        .end(planEnd)
        .step(step.compareTo(MIN_STEP) < 0 ? MIN_STEP : step)
        .timeRange(timeRange(span))
        .build();
  }

  static Duration timeRange(Duration span) {
    if (span.compareTo(Duration.ofDays(28)) >= 0) {
      return Duration.ofHours(3);
    }
    if (span.compareTo(Duration.ofDays(7)) >= 0) {
      return Duration.ofHours(1);
    }
    if (span.compareTo(Duration.ofHours(24)) >= 0) {
      return Duration.ofMinutes(30);
    }
    if (span.compareTo(Duration.ofHours(12)) >= 0) {
      return Duration.ofMinutes(15);
    }
    return Duration.ofMinutes(5);
  }
}
