package org.hypertrace.slo.service.prometheus;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** One series of a range query result, samples ordered by timestamp. */
@Value
@Builder
public class SampleStream {
  @NonNull Labels metric;
  @NonNull @Singular List<SamplePair> values;
}
