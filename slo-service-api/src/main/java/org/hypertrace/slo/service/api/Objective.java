package org.hypertrace.slo.service.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.hypertrace.slo.service.api.promql.ObjectiveQueries;

/**
 * A service level objective as stored by the objective store. Instances are immutable, rewriting
 * the indicator queries always goes through {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Objective {
  @NonNull Map<String, String> labels;
  String description;
  double target;
  @NonNull Duration window;
  @NonNull Indicator indicator;

  /** Value of the {@code __name__} label identifying the objective. */
  @JsonIgnore
  public String getName() {
    return labels.getOrDefault(LabelMatcher.METRIC_NAME, "");
  }

  public String queryTotal(Duration window) {
    return ObjectiveQueries.queryTotal(this, window);
  }

  public String queryErrors(Duration window) {
    return ObjectiveQueries.queryErrors(this, window);
  }

  public String queryErrorBudget() {
    return ObjectiveQueries.queryErrorBudget(this);
  }

  public String requestRange(Duration timeRange) {
    return ObjectiveQueries.requestRange(this, timeRange);
  }

  public String errorsRange(Duration timeRange) {
    return ObjectiveQueries.errorsRange(this, timeRange);
  }

  public List<AlertRule> alerts() {
    return ObjectiveQueries.alerts(this);
  }
}
