package org.hypertrace.slo.service.api;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

public enum AlertState {
  INACTIVE("inactive"),
  PENDING("pending"),
  FIRING("firing");

  private final String value;

  AlertState(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public static Optional<AlertState> fromValue(String value) {
    return Arrays.stream(values()).filter(state -> state.value.equals(value)).findFirst();
  }
}
