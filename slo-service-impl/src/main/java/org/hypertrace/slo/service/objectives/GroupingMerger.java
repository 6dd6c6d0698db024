package org.hypertrace.slo.service.objectives;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.hypertrace.slo.service.api.Indicator;
import org.hypertrace.slo.service.api.LabelMatcher;
import org.hypertrace.slo.service.api.LatencyIndicator;
import org.hypertrace.slo.service.api.MatchType;
import org.hypertrace.slo.service.api.Objective;
import org.hypertrace.slo.service.api.ObjectivesServiceException;
import org.hypertrace.slo.service.api.RatioIndicator;
import org.hypertrace.slo.service.api.promql.InvalidSelectorException;
import org.hypertrace.slo.service.api.promql.MetricSelectorParser;

/**
 * Narrows an objective's indicator queries down to the series picked by a caller supplied
 * selector. The matchers are appended to every metric of the populated indicator and the result
 * is always a new objective, the input stays untouched.
 */
public final class GroupingMerger {

  public enum Mode {
    /** Drops the indicator grouping entirely, queries collapse to one series per objective. */
    COLLAPSE,
    /** Drops only the grouping labels pinned to a single value by an equality matcher. */
    PRUNE_PINNED
  }

  private GroupingMerger() {}

  public static Objective merge(Objective objective, String grouping, Mode mode) {
    if (grouping == null || grouping.isEmpty()) {
      return objective;
    }
    List<LabelMatcher> matchers = parse(grouping);
    Indicator indicator = objective.getIndicator();
    Indicator.IndicatorBuilder merged = indicator.toBuilder();
    if (indicator.isRatio()) {
      RatioIndicator ratio = indicator.getRatio();
      merged.ratio(
          ratio.toBuilder()
              .errors(ratio.getErrors().withAdditionalMatchers(matchers))
              .total(ratio.getTotal().withAdditionalMatchers(matchers))
              .grouping(remainingGrouping(ratio.getGrouping(), matchers, mode))
              .build());
    }
    if (indicator.isLatency()) {
      LatencyIndicator latency = indicator.getLatency();
      merged.latency(
          latency.toBuilder()
              .success(latency.getSuccess().withAdditionalMatchers(matchers))
              .total(latency.getTotal().withAdditionalMatchers(matchers))
              .grouping(remainingGrouping(latency.getGrouping(), matchers, mode))
              .build());
    }
    return objective.toBuilder().indicator(merged.build()).build();
  }

  static List<String> remainingGrouping(
      List<String> grouping, List<LabelMatcher> matchers, Mode mode) {
    switch (mode) {
      case COLLAPSE:
        return List.of();
      case PRUNE_PINNED:
        Set<String> pinned =
            matchers.stream()
                .filter(matcher -> matcher.getType() == MatchType.EQUAL)
                .map(LabelMatcher::getName)
                .collect(Collectors.toSet());
        return grouping.stream()
            .filter(label -> !pinned.contains(label))
            .collect(Collectors.toUnmodifiableList());
      default:
        throw new IllegalArgumentException("Unknown grouping mode " + mode);
    }
  }

  private static List<LabelMatcher> parse(String grouping) {
    try {
      return MetricSelectorParser.parse(grouping);
    } catch (InvalidSelectorException e) {
      throw ObjectivesServiceException.invalidArgument(
          "Invalid grouping " + grouping + ": " + e.getMessage(), e);
    }
  }
}
