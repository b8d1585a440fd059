package com.linkedin.schemaregistry.exceptions;

import org.apache.hc.core5.http.HttpStatus;


/**
 * Thrown when a caller passes a malformed subject name, subject type, version or schema id.
 */
public class InvalidArgumentException extends SchemaRegistryException {
  private static final long serialVersionUID = 1L;

  private final String argumentName;

  public InvalidArgumentException(String argumentName, String message) {
    super("Invalid argument '" + argumentName + "': " + message, ErrorType.BAD_REQUEST);
    this.argumentName = argumentName;
  }

  public InvalidArgumentException(String argumentName, String message, Throwable t) {
    super("Invalid argument '" + argumentName + "': " + message, t, ErrorType.BAD_REQUEST);
    this.argumentName = argumentName;
  }

  public String getArgumentName() {
    return argumentName;
  }

  @Override
  public int getHttpStatusCode() {
    return HttpStatus.SC_BAD_REQUEST;
  }
}
