package org.hypertrace.slo.service.api;

public class ObjectivesServiceException extends RuntimeException {

  public enum Status {
    /** The caller sent a malformed selector or one that does not match exactly one objective. */
    INVALID_ARGUMENT,
    NOT_FOUND,
    INTERNAL
  }

  private final Status status;

  public ObjectivesServiceException(Status status, String message) {
    super(message);
    this.status = status;
  }

  public ObjectivesServiceException(Status status, String message, Throwable cause) {
    super(message, cause);
    this.status = status;
  }

  public static ObjectivesServiceException invalidArgument(String message, Throwable cause) {
    return new ObjectivesServiceException(Status.INVALID_ARGUMENT, message, cause);
  }

  public static ObjectivesServiceException invalidArgument(String message) {
    return new ObjectivesServiceException(Status.INVALID_ARGUMENT, message);
  }

  public static ObjectivesServiceException notFound(String message) {
    return new ObjectivesServiceException(Status.NOT_FOUND, message);
  }

  public static ObjectivesServiceException internal(String message, Throwable cause) {
    return new ObjectivesServiceException(Status.INTERNAL, message, cause);
  }

  public static ObjectivesServiceException internal(String message) {
    return new ObjectivesServiceException(Status.INTERNAL, message);
  }

  public Status getStatus() {
    return status;
  }
}
