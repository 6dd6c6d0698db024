package org.hypertrace.slo.service.prometheus;

import java.util.Arrays;

public enum ResultType {
  SCALAR("scalar"),
  VECTOR("vector"),
  MATRIX("matrix"),
  STRING("string");

  private final String name;

  ResultType(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  static ResultType fromName(String name) {
    return Arrays.stream(values())
        .filter(resultType -> resultType.name.equalsIgnoreCase(name))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown result type " + name));
  }
}
