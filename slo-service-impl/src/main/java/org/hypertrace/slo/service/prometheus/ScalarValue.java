package org.hypertrace.slo.service.prometheus;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public final class ScalarValue extends QueryValue {
  private final long timestamp;
  private final double value;

  public ScalarValue(long timestamp, double value) {
    this.timestamp = timestamp;
    this.value = value;
  }

  @Override
  public ResultType getResultType() {
    return ResultType.SCALAR;
  }

  @Override
  public boolean isEmpty() {
    return false;
  }
}
