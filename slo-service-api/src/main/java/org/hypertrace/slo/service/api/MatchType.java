package org.hypertrace.slo.service.api;

import java.util.Arrays;

/** Comparison applied by a {@link LabelMatcher} to a label value. */
public enum MatchType {
  EQUAL("="),
  NOT_EQUAL("!="),
  REGEX_MATCH("=~"),
  REGEX_NO_MATCH("!~");

  private final String operator;

  MatchType(String operator) {
    this.operator = operator;
  }

  public String getOperator() {
    return operator;
  }

  public boolean isRegex() {
    return this == REGEX_MATCH || this == REGEX_NO_MATCH;
  }

  public static MatchType fromOperator(String operator) {
    return Arrays.stream(values())
        .filter(matchType -> matchType.operator.equals(operator))
        .findFirst()
        .orElseThrow(
            () -> new IllegalArgumentException("Unknown label match operator: " + operator));
  }
}
