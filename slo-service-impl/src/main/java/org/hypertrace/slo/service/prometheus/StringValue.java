package org.hypertrace.slo.service.prometheus;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public final class StringValue extends QueryValue {
  private final long timestamp;
  @NonNull private final String value;

  public StringValue(long timestamp, @NonNull String value) {
    this.timestamp = timestamp;
    this.value = value;
  }

  @Override
  public ResultType getResultType() {
    return ResultType.STRING;
  }

  @Override
  public boolean isEmpty() {
    return false;
  }
}
