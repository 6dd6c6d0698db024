package org.hypertrace.slo.service.prometheus;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class QueryResult {
  @NonNull QueryValue value;

  /** Backend warnings, e.g. about partial or downsampled data. */
  @Singular List<String> warnings;

  public static QueryResult of(QueryValue value) {
    return QueryResult.builder().value(value).build();
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }
}
