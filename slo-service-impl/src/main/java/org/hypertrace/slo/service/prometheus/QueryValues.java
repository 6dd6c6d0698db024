package org.hypertrace.slo.service.prometheus;

import java.util.Optional;

public final class QueryValues {
  private QueryValues() {}

  public static VectorValue requireVector(QueryValue value) {
    return asVector(value)
        .orElseThrow(
            () -> new UnexpectedResultTypeException(ResultType.VECTOR, value.getResultType()));
  }

  public static MatrixValue requireMatrix(QueryValue value) {
    return asMatrix(value)
        .orElseThrow(
            () -> new UnexpectedResultTypeException(ResultType.MATRIX, value.getResultType()));
  }

  public static Optional<VectorValue> asVector(QueryValue value) {
    switch (value.getResultType()) {
      case VECTOR:
        return Optional.of((VectorValue) value);
      case MATRIX:
      case SCALAR:
      case STRING:
        return Optional.empty();
      default:
        throw new IllegalStateException("Unknown result type " + value.getResultType());
    }
  }

  public static Optional<MatrixValue> asMatrix(QueryValue value) {
    switch (value.getResultType()) {
      case MATRIX:
        return Optional.of((MatrixValue) value);
      case VECTOR:
      case SCALAR:
      case STRING:
        return Optional.empty();
      default:
        throw new IllegalStateException("Unknown result type " + value.getResultType());
    }
  }
}
