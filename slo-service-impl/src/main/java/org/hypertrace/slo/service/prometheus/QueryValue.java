package org.hypertrace.slo.service.prometheus;

/**
 * Result of a PromQL evaluation. The concrete class is determined by {@link #getResultType()}:
 * {@link VectorValue}, {@link MatrixValue}, {@link ScalarValue} or {@link StringValue}. Consumers
 * switch over the result type instead of probing with {@code instanceof}, see {@link QueryValues}.
 */
public abstract class QueryValue {
  QueryValue() {}

  public abstract ResultType getResultType();

  public abstract boolean isEmpty();
}
