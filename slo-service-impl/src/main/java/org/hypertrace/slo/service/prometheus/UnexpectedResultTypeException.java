package org.hypertrace.slo.service.prometheus;

public class UnexpectedResultTypeException extends RuntimeException {
  private final ResultType expected;
  private final ResultType actual;

  public UnexpectedResultTypeException(ResultType expected, ResultType actual) {
    super(
        String.format(
            "returned data is not a %s but a %s", expected.getName(), actual.getName()));
    this.expected = expected;
    this.actual = actual;
  }

  public ResultType getExpected() {
    return expected;
  }

  public ResultType getActual() {
    return actual;
  }
}
