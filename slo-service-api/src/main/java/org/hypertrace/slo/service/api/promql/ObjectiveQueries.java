package org.hypertrace.slo.service.api.promql;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.hypertrace.slo.service.api.AlertRule;
import org.hypertrace.slo.service.api.Indicator;
import org.hypertrace.slo.service.api.LabelMatcher;
import org.hypertrace.slo.service.api.Metric;
import org.hypertrace.slo.service.api.Objective;

/**
 * PromQL generated for an objective. Window based queries read the {@code
 * <metric>:increase<window>} and {@code <metric>:burnrate<window>} recording rules, which carry
 * an {@code slo} label naming the objective. Range queries for request and error rates read the
 * raw metrics.
 */
public final class ObjectiveQueries {
  static final String SLO_LABEL = "slo";
  static final String CODE_LABEL = "code";

  private static final String SEVERITY_CRITICAL = "critical";
  private static final String SEVERITY_WARNING = "warning";

  private ObjectiveQueries() {}

  public static String queryTotal(Objective objective, Duration window) {
    Indicator indicator = objective.getIndicator();
    return sum(indicator.getGrouping(), increase(objective, indicator.getTotal(), window));
  }

  public static String queryErrors(Objective objective, Duration window) {
    Indicator indicator = objective.getIndicator();
    List<String> grouping = indicator.getGrouping();
    if (indicator.isRatio()) {
      return sum(grouping, increase(objective, indicator.getRatio().getErrors(), window));
    }
    return sum(grouping, increase(objective, indicator.getTotal(), window))
        + " - "
        + sum(grouping, increase(objective, indicator.getLatency().getSuccess(), window));
  }

  public static String queryErrorBudget(Objective objective) {
    Indicator indicator = objective.getIndicator();
    Duration window = objective.getWindow();
    String total = sum(List.of(), increase(objective, indicator.getTotal(), window));
    String errors;
    if (indicator.isRatio()) {
      errors = sum(List.of(), increase(objective, indicator.getRatio().getErrors(), window));
    } else {
      errors =
          "("
              + total
              + " - "
              + sum(List.of(), increase(objective, indicator.getLatency().getSuccess(), window))
              + ")";
    }
    String budget = "(1 - " + formatNumber(objective.getTarget()) + ")";
    return String.format("(%s - ((%s or vector(0)) / %s)) / %s", budget, errors, total, budget);
  }

  public static String requestRange(Objective objective, Duration timeRange) {
    Indicator indicator = objective.getIndicator();
    Set<String> grouping = new LinkedHashSet<>(indicator.getGrouping());
    if (indicator.isRatio()) {
      grouping.add(CODE_LABEL);
    }
    return sum(grouping, rate(indicator.getTotal(), timeRange)) + " > 0";
  }

  public static String errorsRange(Objective objective, Duration timeRange) {
    Indicator indicator = objective.getIndicator();
    if (indicator.isRatio()) {
      Set<String> grouping = new LinkedHashSet<>(indicator.getGrouping());
      grouping.add(CODE_LABEL);
      return sum(grouping, rate(indicator.getRatio().getErrors(), timeRange))
          + " / scalar("
          + sum(List.of(), rate(indicator.getTotal(), timeRange))
          + ") > 0";
    }
    List<String> grouping = indicator.getGrouping();
    String total = sum(grouping, rate(indicator.getTotal(), timeRange));
    String success = sum(grouping, rate(indicator.getLatency().getSuccess(), timeRange));
    return "(" + total + " - " + success + ") / " + total + " > 0";
  }

  /**
   * Multi-window alerts scaled from the windows recommended for a 28 day objective: a fast pair
   * pages within minutes on a steep burn, slower pairs catch gradual budget loss.
   */
  public static List<AlertRule> alerts(Objective objective) {
    Duration window = objective.getWindow();
    List<AlertRule> rules = new ArrayList<>(4);
    rules.add(alert(objective, SEVERITY_CRITICAL, 14, window, 20160, 8064, 672));
    rules.add(alert(objective, SEVERITY_CRITICAL, 7, window, 2688, 1344, 112));
    rules.add(alert(objective, SEVERITY_WARNING, 2, window, 672, 112, 28));
    rules.add(alert(objective, SEVERITY_WARNING, 1, window, 112, 28, 7));
    return List.copyOf(rules);
  }

  private static AlertRule alert(
      Objective objective,
      String severity,
      double factor,
      Duration window,
      long forDivisor,
      long shortDivisor,
      long longDivisor) {
    Duration shortWindow = roundToMinute(window.dividedBy(shortDivisor));
    Duration longWindow = roundToMinute(window.dividedBy(longDivisor));
    Metric total = objective.getIndicator().getTotal();
    return AlertRule.builder()
        .severity(severity)
        .factor(factor)
        .forDuration(roundToMinute(window.dividedBy(forDivisor)))
        .shortWindow(shortWindow)
        .longWindow(longWindow)
        .queryShort(burnrate(objective, total, shortWindow))
        .queryLong(burnrate(objective, total, longWindow))
        .build();
  }

  private static String increase(Objective objective, Metric metric, Duration window) {
    return recordingRule(objective, metric, ":increase" + PromDuration.format(window));
  }

  private static String burnrate(Objective objective, Metric metric, Duration window) {
    return recordingRule(objective, metric, ":burnrate" + PromDuration.format(window));
  }

  private static String recordingRule(Objective objective, Metric metric, String suffix) {
    List<LabelMatcher> matchers = new ArrayList<>(metric.getLabelMatchers());
    matchers.add(LabelMatcher.equal(SLO_LABEL, objective.getName()));
    return Metric.of(baseName(metric.getName()) + suffix, matchers).toSelector();
  }

  private static String rate(Metric metric, Duration timeRange) {
    return "rate(" + metric.toSelector() + "[" + PromDuration.format(timeRange) + "])";
  }

  private static String sum(Collection<String> grouping, String expression) {
    if (grouping.isEmpty()) {
      return "sum(" + expression + ")";
    }
    return "sum by(" + String.join(", ", grouping) + ") (" + expression + ")";
  }

  static String baseName(String metricName) {
    String name = metricName;
    for (String suffix : List.of("_total", "_count", "_bucket")) {
      if (name.endsWith(suffix)) {
        name = name.substring(0, name.length() - suffix.length());
      }
    }
    return name;
  }

  static Duration roundToMinute(Duration duration) {
    long minute = Duration.ofMinutes(1).toMillis();
    return Duration.ofMillis((duration.toMillis() + minute / 2) / minute * minute);
  }

  static String formatNumber(double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
