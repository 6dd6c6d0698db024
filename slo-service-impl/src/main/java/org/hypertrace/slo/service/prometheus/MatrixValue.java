package org.hypertrace.slo.service.prometheus;

import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public final class MatrixValue extends QueryValue {
  @NonNull private final List<SampleStream> streams;

  public MatrixValue(@NonNull List<SampleStream> streams) {
    this.streams = List.copyOf(streams);
  }

  @Override
  public ResultType getResultType() {
    return ResultType.MATRIX;
  }

  @Override
  public boolean isEmpty() {
    return streams.isEmpty();
  }

  public int size() {
    return streams.size();
  }
}
