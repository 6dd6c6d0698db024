package org.hypertrace.slo.service.prometheus;

import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public final class VectorValue extends QueryValue {
  @NonNull private final List<Sample> samples;

  public VectorValue(@NonNull List<Sample> samples) {
    this.samples = List.copyOf(samples);
  }

  @Override
  public ResultType getResultType() {
    return ResultType.VECTOR;
  }

  @Override
  public boolean isEmpty() {
    return samples.isEmpty();
  }

  public int size() {
    return samples.size();
  }
}
