package org.hypertrace.slo.service.objectives;

import java.io.IOException;

public class ObjectiveStoreException extends IOException {
  private static final int NOT_FOUND = 404;

  private final int statusCode;

  public ObjectiveStoreException(int statusCode, String message) {
    super(message);
    this.statusCode = statusCode;
  }

  public ObjectiveStoreException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  /** HTTP status of the failed response, -1 if no response was decoded. */
  public int getStatusCode() {
    return statusCode;
  }

  public boolean isNotFound() {
    return statusCode == NOT_FOUND;
  }
}
