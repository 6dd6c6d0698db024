package org.hypertrace.slo.service.prometheus;

import lombok.Value;

@Value
public class SamplePair {
  long timestamp;
  double value;
}
