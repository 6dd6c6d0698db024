package org.hypertrace.slo.service.prometheus;

import lombok.NonNull;
import lombok.Value;

/** Single sample of an instant vector, timestamp in epoch milliseconds. */
@Value
public class Sample {
  @NonNull Labels metric;
  long timestamp;
  double value;
}
