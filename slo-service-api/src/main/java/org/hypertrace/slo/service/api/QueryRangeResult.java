package org.hypertrace.slo.service.api;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Columnar time series for charting. {@code values[0]} holds the timestamps in seconds, {@code
 * values[i]} for {@code i > 0} the samples of the series described by {@code labels[i - 1]}.
 *
 * <p>The value matrix is copied on the way in and out, so a built result cannot be altered.
 */
@Value
public class QueryRangeResult {
  @NonNull String query;
  @NonNull List<String> labels;
  @NonNull double[][] values;

  @Builder
  private QueryRangeResult(
      @NonNull String query, @NonNull List<String> labels, @NonNull double[][] values) {
    this.query = query;
    this.labels = List.copyOf(labels);
    this.values = copy(values);
  }

  public double[][] getValues() {
    return copy(values);
  }

  private static double[][] copy(double[][] values) {
    double[][] copy = new double[values.length][];
    for (int i = 0; i < values.length; i++) {
      copy[i] = values[i].clone();
    }
    return copy;
  }
}
