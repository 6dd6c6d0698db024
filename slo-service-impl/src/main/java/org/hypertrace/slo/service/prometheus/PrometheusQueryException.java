package org.hypertrace.slo.service.prometheus;

import java.io.IOException;
import java.util.Optional;

/** A query the backend rejected or failed to answer. */
public class PrometheusQueryException extends IOException {
  private final String errorType;

  public PrometheusQueryException(String message) {
    this(null, message);
  }

  public PrometheusQueryException(String message, Throwable cause) {
    super(message, cause);
    this.errorType = null;
  }

  public PrometheusQueryException(String errorType, String message) {
    super(errorType == null ? message : errorType + ": " + message);
    this.errorType = errorType;
  }

  public Optional<String> getErrorType() {
    return Optional.ofNullable(errorType);
  }
}
