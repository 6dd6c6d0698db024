package org.hypertrace.slo.service.api;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;
import org.hypertrace.slo.service.api.promql.MetricSelectorParser;

/**
 * A metric selector taken apart into its name and the remaining label matchers. The name is kept
 * separately so that query templates can rewrite it, e.g. into the name of a recording rule.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Metric {
  @NonNull String name;
  @NonNull List<LabelMatcher> labelMatchers;

  public static Metric of(String name, List<LabelMatcher> labelMatchers) {
    return new Metric(name, List.copyOf(labelMatchers));
  }

  /** Parses a selector such as {@code http_requests_total{job="api",code=~"5.."}}. */
  public static Metric parse(String selector) {
    List<LabelMatcher> matchers = MetricSelectorParser.parse(selector);
    String name =
        matchers.stream()
            .filter(matcher -> isNameMatcher(matcher))
            .map(LabelMatcher::getValue)
            .findFirst()
            .orElse("");
    return new Metric(
        name,
        matchers.stream()
            .filter(matcher -> !isNameMatcher(matcher))
            .collect(Collectors.toUnmodifiableList()));
  }

  /** Returns a copy with the given matchers appended after the existing ones. */
  public Metric withAdditionalMatchers(Collection<LabelMatcher> additional) {
    List<LabelMatcher> merged = new ArrayList<>(labelMatchers.size() + additional.size());
    merged.addAll(labelMatchers);
    merged.addAll(additional);
    return new Metric(name, List.copyOf(merged));
  }

  public Optional<LabelMatcher> getMatcher(String labelName) {
    return labelMatchers.stream()
        .filter(matcher -> matcher.getName().equals(labelName))
        .findFirst();
  }

  public String toSelector() {
    return name
        + labelMatchers.stream()
            .map(LabelMatcher::toString)
            .collect(Collectors.joining(", ", "{", "}"));
  }

  @Override
  public String toString() {
    return toSelector();
  }

  private static boolean isNameMatcher(LabelMatcher matcher) {
    return LabelMatcher.METRIC_NAME.equals(matcher.getName())
        && matcher.getType() == MatchType.EQUAL;
  }
}
